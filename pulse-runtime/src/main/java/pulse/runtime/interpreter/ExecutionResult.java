package pulse.runtime.interpreter;

import com.pulselang.compiler.analysis.Diagnostic;
import pulse.runtime.deadline.DeadlineViolation;
import pulse.runtime.memory.GcMetricsSample;
import pulse.runtime.safety.SafetyViolation;
import pulse.runtime.timetravel.ExecutionSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次 {@code interpret} 的结果
 *
 * <p>列表均为运行结束时的不可变副本。{@code halted} 表示执行提前结束：
 * 词法/语法错误、静态 ERROR 诊断、CRITICAL 安全违规或运行时错误。</p>
 */
public final class ExecutionResult {

    private final String output;
    private final List<ExecutionSnapshot> snapshots;
    private final List<GcMetricsSample> gcMetrics;
    private final List<DeadlineViolation> deadlineViolations;
    private final List<SafetyViolation> safetyViolations;
    private final List<Diagnostic> diagnostics;
    private final boolean halted;

    public ExecutionResult(String output,
                           List<ExecutionSnapshot> snapshots,
                           List<GcMetricsSample> gcMetrics,
                           List<DeadlineViolation> deadlineViolations,
                           List<SafetyViolation> safetyViolations,
                           List<Diagnostic> diagnostics,
                           boolean halted) {
        this.output = output;
        this.snapshots = copy(snapshots);
        this.gcMetrics = copy(gcMetrics);
        this.deadlineViolations = copy(deadlineViolations);
        this.safetyViolations = copy(safetyViolations);
        this.diagnostics = copy(diagnostics);
        this.halted = halted;
    }

    private static <T> List<T> copy(List<T> source) {
        return Collections.unmodifiableList(new ArrayList<T>(source));
    }

    public String getOutput() { return output; }
    public List<ExecutionSnapshot> getSnapshots() { return snapshots; }
    public List<GcMetricsSample> getGcMetrics() { return gcMetrics; }
    public List<DeadlineViolation> getDeadlineViolations() { return deadlineViolations; }
    public List<SafetyViolation> getSafetyViolations() { return safetyViolations; }
    public List<Diagnostic> getDiagnostics() { return diagnostics; }
    public boolean isHalted() { return halted; }

    @Override
    public String toString() {
        return "ExecutionResult{halted=" + halted
                + ", snapshots=" + snapshots.size()
                + ", gcMetrics=" + gcMetrics.size()
                + ", deadlineViolations=" + deadlineViolations.size()
                + ", safetyViolations=" + safetyViolations.size()
                + ", diagnostics=" + diagnostics.size() + "}";
    }
}
