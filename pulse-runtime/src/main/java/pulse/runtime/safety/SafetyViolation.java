package pulse.runtime.safety;

/**
 * 一次安全违规
 */
public final class SafetyViolation {

    private final ViolationKind kind;
    private final int line;
    private final String message;
    private final Severity severity;
    private final long timestamp;

    public SafetyViolation(ViolationKind kind, int line, String message, Severity severity, long timestamp) {
        this.kind = kind;
        this.line = line;
        this.message = message;
        this.severity = severity;
        this.timestamp = timestamp;
    }

    public ViolationKind getKind() { return kind; }
    public int getLine() { return line; }
    public String getMessage() { return message; }
    public Severity getSeverity() { return severity; }
    public long getTimestamp() { return timestamp; }

    public boolean isCritical() {
        return severity.isCritical();
    }

    /**
     * {@code @SafetyCheck} 方法内 ERROR 级违规升级为 CRITICAL
     */
    public SafetyViolation escalate() {
        if (severity != Severity.ERROR) {
            return this;
        }
        return new SafetyViolation(kind, line, message, Severity.CRITICAL, timestamp);
    }

    @Override
    public String toString() {
        return "SAFETY VIOLATION [" + severity + "]: " + message + " (Line " + line + ")";
    }
}
