package pulse.runtime;

/**
 * PulseLang 基础运行时异常（无源位置信息）。
 *
 * <p>{@code pulse.runtime.interpreter.PulseRuntimeException} 继承此类，
 * 并添加 SourceLocation 等诊断信息。</p>
 */
public class PulseException extends RuntimeException {

    public PulseException(String message) {
        super(message);
    }

    public PulseException(String message, Throwable cause) {
        super(message, cause);
    }
}
