package pulse.runtime.safety;

import java.util.Collections;
import java.util.List;

/**
 * 方法调用深度的作用域守卫
 *
 * <p>由 {@link SafetyVerifier#enterMethod(int)} 取得，close 时归还深度。
 * 即使方法体因终止异常退出，深度也会被释放：</p>
 * <pre>
 * try (CallDepthGuard guard = verifier.enterMethod(line)) {
 *     report(guard.getViolations());
 *     ...
 * }
 * </pre>
 */
public final class CallDepthGuard implements AutoCloseable {

    private final SafetyVerifier verifier;
    private final int depth;
    private final List<SafetyViolation> violations;
    private boolean closed;

    CallDepthGuard(SafetyVerifier verifier, int depth, List<SafetyViolation> violations) {
        this.verifier = verifier;
        this.depth = depth;
        this.violations = Collections.unmodifiableList(violations);
    }

    /** 进入后的调用深度 */
    public int getDepth() {
        return depth;
    }

    /** 进入时检测到的违规（深度超限） */
    public List<SafetyViolation> getViolations() {
        return violations;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            verifier.exitMethod();
        }
    }
}
