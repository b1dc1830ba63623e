package pulse.runtime.safety;

/**
 * 违规严重级别，CRITICAL 会终止执行
 */
public enum Severity {
    WARNING,
    ERROR,
    CRITICAL;

    public boolean isCritical() {
        return this == CRITICAL;
    }
}
