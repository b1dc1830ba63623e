package pulse.runtime.interpreter;

import com.pulselang.compiler.ast.SourceLocation;
import pulse.runtime.safety.SafetyViolation;

/**
 * CRITICAL 级安全违规导致的终止
 */
public class SafetyHaltException extends PulseRuntimeException {

    private final SafetyViolation violation;

    public SafetyHaltException(SafetyViolation violation, SourceLocation location) {
        super(violation.getMessage(), location);
        this.violation = violation;
    }

    public SafetyViolation getViolation() {
        return violation;
    }
}
