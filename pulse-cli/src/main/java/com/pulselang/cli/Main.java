package com.pulselang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * PulseLang CLI 入口点（picocli）
 */
@Command(name = "pulse", version = "PulseLang v0.1.0",
         mixinStandardHelpOptions = true,
         description = "PulseLang 解释器与实时运行时",
         subcommands = {RunCommand.class, CheckCommand.class, FmtCommand.class, DebugCommand.class})
public class Main implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * 创建配置好的命令行对象，测试中可替换输出流
     */
    static CommandLine commandLine() {
        return new CommandLine(new Main());
    }

    public static void main(String[] args) {
        LoggingSetup.install(false);
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
