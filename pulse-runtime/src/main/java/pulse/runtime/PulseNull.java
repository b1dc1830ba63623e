package pulse.runtime;

/**
 * Pulse null 值和 void 值
 */
public final class PulseNull extends PulseValue {

    /** 唯一的 null 实例 */
    public static final PulseNull NULL = new PulseNull(true);

    /** void 方法的返回值 */
    public static final PulseNull VOID = new PulseNull(false);

    private final boolean isNullValue;

    private PulseNull(boolean isNullValue) {
        this.isNullValue = isNullValue;
    }

    @Override
    public String getTypeName() {
        return isNullValue ? "null" : "void";
    }

    @Override
    public int getSize() {
        return 0;
    }

    @Override
    public Object toJavaValue() {
        return null;
    }

    @Override
    public boolean isNull() {
        return isNullValue;
    }

    public boolean isVoid() {
        return !isNullValue;
    }

    @Override
    public boolean valueEquals(PulseValue other) {
        return other == this;
    }

    @Override
    public String toString() {
        return isNullValue ? "null" : "void";
    }
}
