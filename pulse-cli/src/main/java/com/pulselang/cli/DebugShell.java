package com.pulselang.cli;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import pulse.runtime.PulseValue;
import pulse.runtime.deadline.DeadlineViolation;
import pulse.runtime.interpreter.PulseInterpreter;
import pulse.runtime.memory.GcMetricsSample;
import pulse.runtime.safety.SafetyViolation;
import pulse.runtime.timetravel.ExecutionSnapshot;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 时间旅行调试交互（jline）
 *
 * <p>在一次运行结束后浏览快照历史，也可查询堆状态或强制 GC。</p>
 */
public class DebugShell {

    private static final String PROMPT = "pulse-debug> ";

    private final PulseInterpreter interpreter;
    private final PrintWriter out;

    public DebugShell(PulseInterpreter interpreter, PrintWriter out) {
        this.interpreter = interpreter;
        this.out = out;
    }

    /**
     * 启动交互循环
     */
    public void run() {
        out.println("快照: " + interpreter.getSnapshots().size() + "，输入 :help 获取帮助，:quit 退出");
        interpreter.currentSnapshot().ifPresent(this::printSnapshot);
        out.flush();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .build();
            runLoop(reader);
        } catch (IOException e) {
            out.println("终端初始化失败: " + e.getMessage());
            runFallbackLoop();
        }
        out.println("再见！");
        out.flush();
    }

    private void runLoop(LineReader reader) {
        while (true) {
            try {
                String line = reader.readLine(PROMPT);
                if (line == null || !execute(line)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 放弃当前输入
            } catch (EndOfFileException e) {
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败时使用 BufferedReader）
     */
    private void runFallbackLoop() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        while (true) {
            out.print(PROMPT);
            out.flush();
            try {
                String line = reader.readLine();
                if (line == null || !execute(line)) break;
            } catch (IOException e) {
                out.println("读取输入时出错: " + e.getMessage());
                break;
            }
        }
    }

    /**
     * 执行一条调试命令
     *
     * @return false 表示退出
     */
    boolean execute(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) return true;

        // 前导冒号可省略
        String[] parts = trimmed.split("\\s+");
        String command = parts[0].startsWith(":") ? parts[0] : ":" + parts[0];
        try {
            switch (command) {
                case ":quit":
                case ":q":
                case ":exit":
                    return false;
                case ":help":
                case ":h":
                    printHelp();
                    break;
                case ":back":
                case ":b":
                    step(parts, true);
                    break;
                case ":forward":
                case ":f":
                    step(parts, false);
                    break;
                case ":jump":
                case ":j":
                    if (parts.length < 2) {
                        out.println("用法: :jump <snapshot_id>");
                    } else {
                        moved(interpreter.jumpToSnapshot(parts[1]), "快照不存在: " + parts[1]);
                    }
                    break;
                case ":show":
                    Optional<ExecutionSnapshot> current = interpreter.currentSnapshot();
                    if (current.isPresent()) {
                        printSnapshot(current.get());
                    } else {
                        out.println("没有快照");
                    }
                    break;
                case ":list":
                    for (ExecutionSnapshot snapshot : interpreter.getSnapshots()) {
                        out.println("  " + snapshot);
                    }
                    break;
                case ":output":
                    interpreter.currentSnapshot().ifPresent(s -> out.print(s.getOutput()));
                    break;
                case ":heap":
                    out.println(interpreter.getHeapStatus());
                    break;
                case ":gc":
                    printSample(interpreter.triggerGC());
                    break;
                case ":violations":
                    printViolations();
                    break;
                default:
                    out.println("未知命令: " + parts[0] + "（输入 :help 获取帮助）");
            }
        } catch (NumberFormatException e) {
            out.println("步数必须是正整数: " + e.getMessage());
        }
        out.flush();
        return true;
    }

    private void step(String[] parts, boolean back) {
        int steps = parts.length > 1 ? Integer.parseInt(parts[1]) : 1;
        if (steps < 1) {
            throw new NumberFormatException(parts[1]);
        }
        Optional<ExecutionSnapshot> result = Optional.empty();
        for (int i = 0; i < steps; i++) {
            result = back ? interpreter.stepBackInTime() : interpreter.stepForwardInTime();
        }
        moved(result, "没有快照");
    }

    private void moved(Optional<ExecutionSnapshot> snapshot, String missing) {
        if (snapshot.isPresent()) {
            printSnapshot(snapshot.get());
        } else {
            out.println(missing);
        }
    }

    private void printSnapshot(ExecutionSnapshot snapshot) {
        out.println("[" + snapshot.getId() + "] line " + snapshot.getLine()
                + "  调用栈: " + String.join(" > ", snapshot.getCallStack()));
        for (Map.Entry<String, PulseValue> entry : snapshot.getVariables().entrySet()) {
            PulseValue value = entry.getValue();
            out.println("  " + entry.getKey() + " = " + value + " : " + value.getTypeName());
        }
    }

    private void printSample(GcMetricsSample sample) {
        out.println(String.format(Locale.ROOT,
                "GC #%d: 暂停 %.2fms, 释放 %d, 堆 %.1f%%, off-heap %.1f%%",
                sample.getCollections(), sample.getPauseTimeMs(), sample.getFreedCount(),
                sample.getHeapUsagePct(), sample.getOffHeapUsagePct()));
    }

    private void printViolations() {
        List<SafetyViolation> safety = interpreter.getSafetyViolations();
        List<DeadlineViolation> deadlines = interpreter.getDeadlineViolations();
        if (safety.isEmpty() && deadlines.isEmpty()) {
            out.println("没有违规");
            return;
        }
        for (SafetyViolation violation : safety) {
            out.println("  " + violation);
        }
        for (DeadlineViolation violation : deadlines) {
            out.println("  " + violation);
        }
    }

    private void printHelp() {
        out.println("调试命令:");
        out.println("  :back [n]       后退 n 个快照（默认 1）");
        out.println("  :forward [n]    前进 n 个快照（默认 1）");
        out.println("  :jump <id>      跳到指定快照");
        out.println("  :show           显示当前快照");
        out.println("  :list           列出全部快照");
        out.println("  :output         当前快照时刻的输出");
        out.println("  :heap           堆与 off-heap 状态");
        out.println("  :gc             强制执行一次 GC");
        out.println("  :violations     安全与截止时间违规");
        out.println("  :quit           退出");
    }
}
