package pulse.runtime.safety;

/**
 * 安全违规种类
 */
public enum ViolationKind {
    DIVISION_BY_ZERO,
    ARRAY_BOUNDS,
    NULL_ACCESS,
    STACK_OVERFLOW,
    HEAP_OVERFLOW
}
