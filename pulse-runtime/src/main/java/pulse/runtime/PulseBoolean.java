package pulse.runtime;

/**
 * Pulse boolean 值
 */
public final class PulseBoolean extends PulseValue {

    private final boolean value;

    public PulseBoolean(boolean value) {
        this.value = value;
    }

    public static PulseBoolean of(boolean value) {
        return new PulseBoolean(value);
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "boolean";
    }

    @Override
    public int getSize() {
        return 1;
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean valueEquals(PulseValue other) {
        return other instanceof PulseBoolean && value == ((PulseBoolean) other).value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
