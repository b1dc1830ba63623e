package pulse.runtime.deadline;

import pulse.runtime.safety.Severity;

import java.util.Locale;

/**
 * 一次截止时间违规：实际耗时超过 {@code @Deadline(ms=N)}
 *
 * <p>超过两倍期望值为 CRITICAL，否则为 WARNING。截止时间违规从不终止执行。</p>
 */
public final class DeadlineViolation {

    private final String methodName;
    private final long expectedMs;
    private final double actualMs;
    private final int line;
    private final long timestamp;
    private final Severity severity;

    public DeadlineViolation(String methodName, long expectedMs, double actualMs, int line, long timestamp) {
        this.methodName = methodName;
        this.expectedMs = expectedMs;
        this.actualMs = actualMs;
        this.line = line;
        this.timestamp = timestamp;
        this.severity = actualMs > expectedMs * 2.0 ? Severity.CRITICAL : Severity.WARNING;
    }

    public String getMethodName() { return methodName; }
    public long getExpectedMs() { return expectedMs; }
    public double getActualMs() { return actualMs; }
    public int getLine() { return line; }
    public long getTimestamp() { return timestamp; }
    public Severity getSeverity() { return severity; }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "DEADLINE VIOLATION: %s took %.2fms (expected %dms)",
                methodName, actualMs, expectedMs);
    }
}
