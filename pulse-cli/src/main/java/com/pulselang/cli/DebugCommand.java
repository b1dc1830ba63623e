package com.pulselang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import pulse.runtime.interpreter.ExecutionResult;
import pulse.runtime.interpreter.PulseInterpreter;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * 执行源文件后进入时间旅行调试
 */
@Command(name = "debug", mixinStandardHelpOptions = true,
         description = "执行源文件后浏览执行快照")
public class DebugCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "源文件路径")
    Path file;

    @Mixin
    RuntimeOptions runtime;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            String source = SourceFiles.read(file);
            PulseInterpreter interpreter = runtime.createInterpreter();
            ExecutionResult result = interpreter.interpret(source, file.getFileName().toString());
            out.print(result.getOutput());
            out.println("--- 执行结束" + (result.isHalted() ? "（已中止）" : "") + " ---");
            new DebugShell(interpreter, out).run();
            return 0;
        } catch (IOException | IllegalArgumentException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        }
    }
}
