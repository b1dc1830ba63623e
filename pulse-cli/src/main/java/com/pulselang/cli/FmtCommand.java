package com.pulselang.cli;

import com.pulselang.compiler.formatter.AstPrinter;
import com.pulselang.compiler.formatter.PrintConfig;
import com.pulselang.compiler.lexer.LexException;
import com.pulselang.compiler.lexer.Lexer;
import com.pulselang.compiler.parser.ParseError;
import com.pulselang.compiler.parser.ParseResult;
import com.pulselang.compiler.parser.Parser;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * 格式化 PulseLang 源文件
 */
@Command(name = "fmt", mixinStandardHelpOptions = true,
         description = "格式化 PulseLang 源文件")
public class FmtCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "源文件路径")
    Path file;

    @Option(names = "--indent-size", description = "缩进空格数（默认 4）", defaultValue = "4")
    int indentSize;

    @Option(names = "--use-tabs", description = "使用 tab 缩进")
    boolean useTabs;

    @Option(names = "--compact", description = "类内方法之间不空行")
    boolean compact;

    @Option(names = {"-w", "--write"}, description = "写回源文件而不是打印到标准输出")
    boolean write;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            String source = SourceFiles.read(file);
            ParseResult parsed = new Parser(new Lexer(source, file.getFileName().toString())).parseTolerant();
            if (parsed.hasErrors()) {
                // 有语法错误时不改动源码
                for (ParseError e : parsed.getErrors()) {
                    err.println("格式化错误: " + e);
                }
                return 1;
            }

            PrintConfig config = new PrintConfig()
                    .setIndentSize(indentSize)
                    .setUseSpaces(!useTabs)
                    .setBlankLineBetweenMethods(!compact);
            String formatted = new AstPrinter().print(parsed.getProgram(), config);

            if (write) {
                Files.write(file, formatted.getBytes(StandardCharsets.UTF_8));
                out.println("已格式化: " + file);
            } else {
                out.print(formatted);
            }
            out.flush();
            return 0;
        } catch (LexException e) {
            err.println("格式化错误: " + e.getMessage());
            return 1;
        } catch (IOException | IllegalArgumentException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        }
    }
}
