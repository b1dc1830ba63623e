package pulse.runtime;

/**
 * Pulse String 值，名义大小按 UTF-16 计为每字符 2 字节
 */
public final class PulseString extends PulseValue {

    private final String value;

    public PulseString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null, use PulseNull.NULL");
        }
        this.value = value;
    }

    public static PulseString of(String value) {
        return new PulseString(value);
    }

    public String getValue() {
        return value;
    }

    public int length() {
        return value.length();
    }

    @Override
    public String getTypeName() {
        return "String";
    }

    @Override
    public int getSize() {
        return value.length() * 2;
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean isString() {
        return true;
    }

    @Override
    public boolean valueEquals(PulseValue other) {
        return other instanceof PulseString && value.equals(((PulseString) other).value);
    }

    @Override
    public String toString() {
        return value;
    }
}
