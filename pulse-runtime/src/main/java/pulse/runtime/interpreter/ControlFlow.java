package pulse.runtime.interpreter;

import pulse.runtime.PulseNull;
import pulse.runtime.PulseValue;

/**
 * 控制流异常
 *
 * <p>用于实现 return，从方法体任意深度跳回调用点。
 * 这不是真正的错误，而是用于跳出正常执行流程的机制。</p>
 */
public final class ControlFlow extends RuntimeException {

    private final PulseValue value;

    private ControlFlow(PulseValue value) {
        super(null, null, false, false);  // 禁用堆栈跟踪以提高性能
        this.value = value;
    }

    public PulseValue getValue() {
        return value;
    }

    // ============ 工厂方法 ============

    public static ControlFlow returnValue(PulseValue value) {
        return new ControlFlow(value);
    }

    public static ControlFlow returnVoid() {
        return new ControlFlow(PulseNull.VOID);
    }
}
