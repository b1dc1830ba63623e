package com.pulselang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import pulse.runtime.interpreter.ExecutionResult;
import pulse.runtime.interpreter.HeapStatus;
import pulse.runtime.interpreter.PulseInterpreter;
import pulse.runtime.memory.GcMetricsSample;
import pulse.runtime.report.ResultJsonWriter;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * 执行 PulseLang 源文件
 */
@Command(name = "run", mixinStandardHelpOptions = true,
         description = "执行 PulseLang 源文件")
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "源文件路径")
    Path file;

    @Option(names = "--json", description = "以 JSON 输出执行结果")
    boolean json;

    @Option(names = "--snapshots", description = "JSON 中包含完整快照历史")
    boolean snapshots;

    @Option(names = "--stats", description = "执行后打印违规、GC 与堆摘要")
    boolean stats;

    @Mixin
    RuntimeOptions runtime;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String source;
        PulseInterpreter interpreter;
        try {
            source = SourceFiles.read(file);
            interpreter = runtime.createInterpreter();
        } catch (IOException | IllegalArgumentException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        }

        ExecutionResult result = interpreter.interpret(source, file.getFileName().toString());
        if (json) {
            out.println(new ResultJsonWriter(snapshots).write(result));
        } else {
            out.print(result.getOutput());
            if (stats) {
                printStats(out, result, interpreter.getHeapStatus());
            }
        }
        out.flush();
        return result.isHalted() ? 1 : 0;
    }

    static void printStats(PrintWriter out, ExecutionResult result, HeapStatus heap) {
        out.println("--- 执行摘要 ---");
        out.println("安全违规: " + result.getSafetyViolations().size());
        out.println("截止时间违规: " + result.getDeadlineViolations().size());
        out.println("快照: " + result.getSnapshots().size());

        List<GcMetricsSample> metrics = result.getGcMetrics();
        if (metrics.isEmpty()) {
            out.println("GC: 未触发");
        } else {
            GcMetricsSample last = metrics.get(metrics.size() - 1);
            out.println(String.format(Locale.ROOT, "GC: %d 次收集, 最近暂停 %.2fms, 释放 %d 个对象%s",
                    last.getCollections(), last.getPauseTimeMs(), last.getFreedCount(),
                    last.isSimulated() ? "（模拟）" : ""));
        }
        out.println("堆: " + heap);
    }
}
