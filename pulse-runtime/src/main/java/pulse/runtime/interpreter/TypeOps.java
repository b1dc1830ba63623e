package pulse.runtime.interpreter;

import com.pulselang.compiler.ast.TypeRef;
import com.pulselang.compiler.ast.SourceLocation;
import pulse.runtime.*;

/**
 * 声明类型相关的转换：默认值和赋值转换。
 */
final class TypeOps {
    private TypeOps() {}

    /**
     * 未初始化声明的默认值：数值为 0，boolean 为 false，其余为 null
     */
    static PulseValue defaultValue(TypeRef type) {
        if (type.isArray()) return PulseNull.NULL;
        switch (type.getName()) {
            case "int": return PulseInt.of(0);
            case "double": return PulseDouble.of(0.0);
            case "boolean": return PulseBoolean.of(false);
            default: return PulseNull.NULL;
        }
    }

    /**
     * 按声明类型转换值：int ← double 截断，double ← int 拓宽
     *
     * @return 转换后的值；类型不兼容时返回 null
     */
    static PulseValue coerce(TypeRef type, PulseValue value) {
        if (value instanceof PulseNull && ((PulseNull) value).isVoid()) {
            return null;
        }
        if (type.isArray()) {
            if (value.isNull()) return value;
            if (value instanceof PulseArray
                    && ((PulseArray) value).getElementType().equals(type.elementType().toString())) {
                return value;
            }
            return null;
        }
        switch (type.getName()) {
            case "int":
                if (value instanceof PulseInt) return value;
                if (value instanceof PulseDouble) return PulseInt.of((int) ((PulseDouble) value).getValue());
                return null;
            case "double":
                if (value instanceof PulseDouble) return value;
                if (value instanceof PulseInt) return PulseDouble.of(((PulseInt) value).getValue());
                return null;
            case "boolean":
                return value instanceof PulseBoolean ? value : null;
            case "String":
                return value instanceof PulseString || value.isNull() ? value : null;
            default:
                if (value.isNull()) return value;
                if (value instanceof PulseObject
                        && ((PulseObject) value).getClassName().equals(type.getName())) {
                    return value;
                }
                return null;
        }
    }

    /**
     * 同 {@link #coerce}，不兼容时抛出运行时异常
     */
    static PulseValue coerceOrThrow(TypeRef type, PulseValue value, SourceLocation loc) {
        PulseValue result = coerce(type, value);
        if (result == null) {
            throw new PulseRuntimeException("Type mismatch: cannot assign "
                    + value.getTypeName() + " to " + type, loc);
        }
        return result;
    }

    /**
     * 数值的 double 形式；非数值返回 NaN
     */
    static double toDouble(PulseValue value) {
        return value instanceof PulseNumber ? ((PulseNumber) value).asDouble() : Double.NaN;
    }
}
