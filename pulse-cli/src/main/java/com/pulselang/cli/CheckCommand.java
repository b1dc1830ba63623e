package com.pulselang.cli;

import com.pulselang.compiler.analysis.Diagnostic;
import com.pulselang.compiler.analysis.SyntaxValidator;
import com.pulselang.compiler.lexer.LexException;
import com.pulselang.compiler.lexer.Lexer;
import com.pulselang.compiler.lexer.Token;
import com.pulselang.compiler.parser.ParseResult;
import com.pulselang.compiler.parser.Parser;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * 只做静态检查，不执行
 *
 * <p>先报告静态检查的诊断，再报告容错解析的语法错误。输出格式为
 * {@code 文件:行:列: severity: 消息}，存在错误时退出码为 1。</p>
 */
@Command(name = "check", mixinStandardHelpOptions = true,
         description = "静态检查 PulseLang 源文件（不执行）")
public class CheckCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "源文件路径")
    Path file;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String source;
        try {
            source = SourceFiles.read(file);
        } catch (IOException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        }
        String name = file.getFileName().toString();

        List<Token> tokens;
        try {
            tokens = new Lexer(source, name).scanTokens();
        } catch (LexException e) {
            out.println(format(name, e.getLine(), e.getColumn(), "error", e.getRawMessage()));
            out.flush();
            return 1;
        }

        List<Diagnostic> diagnostics = new ArrayList<Diagnostic>(new SyntaxValidator(tokens).validate());
        ParseResult parsed = new Parser(new Lexer(source, name)).parseTolerant();
        diagnostics.addAll(parsed.toDiagnostics());

        int errors = 0;
        int warnings = 0;
        for (Diagnostic d : diagnostics) {
            out.println(format(name, d.getLine(), d.getColumn(),
                    d.isError() ? "error" : "warning", d.getMessage()));
            if (d.isError()) {
                errors++;
            } else {
                warnings++;
            }
        }

        if (errors == 0 && warnings == 0) {
            out.println("No problems found");
        } else {
            out.println(errors + " error(s), " + warnings + " warning(s)");
        }
        out.flush();
        return errors > 0 ? 1 : 0;
    }

    private static String format(String file, int line, int column, String severity, String message) {
        return file + ":" + line + ":" + column + ": " + severity + ": " + message;
    }
}
