package pulse.runtime;

/**
 * Pulse double 值（64位浮点数）
 */
public final class PulseDouble extends PulseValue implements PulseNumber {

    private final double value;

    public PulseDouble(double value) {
        this.value = value;
    }

    public static PulseDouble of(double value) {
        return new PulseDouble(value);
    }

    public double getValue() {
        return value;
    }

    @Override
    public double asDouble() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "double";
    }

    @Override
    public int getSize() {
        return 8;
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
        if (other instanceof PulseNumber) {
            return value == ((PulseNumber) other).asDouble();
        }
        return false;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
