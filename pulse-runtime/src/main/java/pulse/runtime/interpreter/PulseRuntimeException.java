package pulse.runtime.interpreter;

import com.pulselang.compiler.ast.SourceLocation;
import pulse.runtime.PulseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 用户代码引起的运行时错误
 *
 * <p>携带出错位置；异常穿过方法帧向外传播时，求值器依次记下帧名，
 * 得到 PulseLang 层面的调用轨迹（最内层在前）。</p>
 */
public class PulseRuntimeException extends PulseException {

    private final SourceLocation location;
    private final List<String> trace = new ArrayList<String>();

    public PulseRuntimeException(String message) {
        this(message, null);
    }

    public PulseRuntimeException(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 出错行号，未知时为 0 */
    public int getLine() {
        return location != null ? location.getLine() : 0;
    }

    /** 不含位置和调用轨迹的错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    /**
     * 记录异常穿过的方法帧
     */
    void unwindThrough(String frameLabel) {
        trace.add(frameLabel);
    }

    /** 最内层在前 */
    public List<String> getTrace() {
        return Collections.unmodifiableList(trace);
    }

    /**
     * 形如：
     * <pre>
     * Undefined variable 'y'
     *   --> sensor.pulse:5:17
     *   at read[temperature]
     *   at main
     * </pre>
     */
    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (location != null && location.isKnown()) {
            sb.append("\n  --> ").append(location);
        }
        for (String frame : trace) {
            sb.append("\n  at ").append(frame);
        }
        return sb.toString();
    }
}
