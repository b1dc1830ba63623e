package pulse.runtime.safety;

import pulse.runtime.PulseArray;
import pulse.runtime.PulseNumber;
import pulse.runtime.PulseValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * 安全校验器
 *
 * <p>各检查本身无状态，只返回零个或多个违规，如何处理由调用方决定。
 * 唯一的状态是调用深度计数，通过 {@link CallDepthGuard} 成对增减。</p>
 */
public final class SafetyVerifier {

    private final int maxCallDepth;
    private final long heapBudget;
    private final LongSupplier clock;
    private int currentDepth;

    public SafetyVerifier(int maxCallDepth, long heapBudget) {
        this(maxCallDepth, heapBudget, System::currentTimeMillis);
    }

    /**
     * @param clock 违规时间戳来源（毫秒）
     */
    public SafetyVerifier(int maxCallDepth, long heapBudget, LongSupplier clock) {
        if (maxCallDepth <= 0) {
            throw new IllegalArgumentException("maxCallDepth must be positive: " + maxCallDepth);
        }
        this.maxCallDepth = maxCallDepth;
        this.heapBudget = heapBudget;
        this.clock = clock;
    }

    /**
     * 按种类分派的通用入口
     *
     * <p>操作数约定：DIVISION {@code (dividend, divisor)}；ARRAY_ACCESS
     * {@code (array, index)}；MEMORY_ALLOCATION {@code (requested, used)}；
     * NULL_ACCESS {@code (target)}。METHOD_CALL 只检查再进入一层是否超限，不改变计数，
     * 要占用深度请使用 {@link #enterMethod(int)}。</p>
     */
    public List<SafetyViolation> verify(CheckKind kind, int line, Object... operands) {
        switch (kind) {
            case DIVISION:
                return checkDivision((PulseValue) operands[0], (PulseValue) operands[1], line);
            case ARRAY_ACCESS:
                return checkArrayAccess((PulseArray) operands[0], ((Number) operands[1]).intValue(), line);
            case METHOD_CALL:
                return checkDepth(currentDepth + 1, line);
            case MEMORY_ALLOCATION:
                return checkAllocation(((Number) operands[0]).longValue(), ((Number) operands[1]).longValue(), line);
            case NULL_ACCESS:
                return checkNullAccess((PulseValue) operands[0], line);
            default:
                throw new IllegalArgumentException("Unknown check kind: " + kind);
        }
    }

    public List<SafetyViolation> checkDivision(PulseValue dividend, PulseValue divisor, int line) {
        if (divisor instanceof PulseNumber && ((PulseNumber) divisor).asDouble() == 0) {
            return single(ViolationKind.DIVISION_BY_ZERO, line,
                    "Division by zero detected: " + dividend + " / " + divisor, Severity.CRITICAL);
        }
        return Collections.emptyList();
    }

    public List<SafetyViolation> checkArrayAccess(PulseArray array, int index, int line) {
        if (!array.isInBounds(index)) {
            return single(ViolationKind.ARRAY_BOUNDS, line,
                    "Array index out of bounds: index " + index + ", array length " + array.length(),
                    Severity.ERROR);
        }
        return Collections.emptyList();
    }

    public List<SafetyViolation> checkNullAccess(PulseValue target, int line) {
        if (target == null || target.isNull()) {
            return single(ViolationKind.NULL_ACCESS, line, "Null pointer access detected", Severity.ERROR);
        }
        return Collections.emptyList();
    }

    /**
     * @param requested 本次分配的字节数
     * @param used      当前堆上已用字节数
     */
    public List<SafetyViolation> checkAllocation(long requested, long used, int line) {
        if (used + requested > heapBudget) {
            return single(ViolationKind.HEAP_OVERFLOW, line,
                    "Heap overflow: requested " + requested + " bytes, available " + (heapBudget - used),
                    Severity.CRITICAL);
        }
        return Collections.emptyList();
    }

    // ============ 调用深度 ============

    /**
     * 占用一层调用深度；超过上限时守卫携带 CRITICAL 违规
     */
    public CallDepthGuard enterMethod(int line) {
        currentDepth++;
        return new CallDepthGuard(this, currentDepth, checkDepth(currentDepth, line));
    }

    void exitMethod() {
        if (currentDepth > 0) {
            currentDepth--;
        }
    }

    private List<SafetyViolation> checkDepth(int depth, int line) {
        if (depth > maxCallDepth) {
            return single(ViolationKind.STACK_OVERFLOW, line,
                    "Stack overflow: depth " + depth + " exceeds maximum " + maxCallDepth, Severity.CRITICAL);
        }
        return Collections.emptyList();
    }

    public int getCurrentDepth() {
        return currentDepth;
    }

    public int getMaxCallDepth() {
        return maxCallDepth;
    }

    public void reset() {
        currentDepth = 0;
    }

    private List<SafetyViolation> single(ViolationKind kind, int line, String message, Severity severity) {
        List<SafetyViolation> result = new ArrayList<SafetyViolation>(1);
        result.add(new SafetyViolation(kind, line, message, severity, clock.getAsLong()));
        return result;
    }
}
