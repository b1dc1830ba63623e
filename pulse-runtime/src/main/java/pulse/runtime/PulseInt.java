package pulse.runtime;

/**
 * Pulse int 值（32位整数）
 */
public final class PulseInt extends PulseValue implements PulseNumber {

    private final int value;

    public PulseInt(int value) {
        this.value = value;
    }

    public static PulseInt of(int value) {
        return new PulseInt(value);
    }

    public int getValue() {
        return value;
    }

    @Override
    public double asDouble() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "int";
    }

    @Override
    public int getSize() {
        return 4;
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isNumber() {
        return true;
    }

    @Override
    public boolean valueEquals(PulseValue other) {
        if (other instanceof PulseInt) {
            return value == ((PulseInt) other).value;
        }
        if (other instanceof PulseDouble) {
            return value == ((PulseDouble) other).getValue();
        }
        return false;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
