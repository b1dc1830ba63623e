package pulse.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Pulse 数组值
 *
 * <p>元素列表不可变，下标赋值通过 {@link #with(int, PulseValue)} 产生新数组。
 * 名义大小为 16 字节头加各元素大小之和。</p>
 */
public final class PulseArray extends PulseValue {

    private static final int HEADER_SIZE = 16;

    private final String elementType;
    private final List<PulseValue> elements;

    public PulseArray(String elementType, List<PulseValue> elements) {
        this.elementType = elementType;
        this.elements = Collections.unmodifiableList(new ArrayList<PulseValue>(elements));
    }

    /**
     * 元素类型名，如 {@code int}、{@code String}、{@code int[]}
     */
    public String getElementType() {
        return elementType;
    }

    public List<PulseValue> getElements() {
        return elements;
    }

    public int length() {
        return elements.size();
    }

    public PulseValue get(int index) {
        return elements.get(index);
    }

    public boolean isInBounds(int index) {
        return index >= 0 && index < elements.size();
    }

    /**
     * 返回替换了第 index 个元素的新数组
     */
    public PulseArray with(int index, PulseValue value) {
        List<PulseValue> copy = new ArrayList<PulseValue>(elements);
        copy.set(index, value);
        return new PulseArray(elementType, copy);
    }

    @Override
    public String getTypeName() {
        return elementType + "[]";
    }

    @Override
    public int getSize() {
        int size = HEADER_SIZE;
        for (PulseValue element : elements) {
            size += element.getSize();
        }
        return size;
    }

    @Override
    public Object toJavaValue() {
        List<Object> result = new ArrayList<Object>(elements.size());
        for (PulseValue element : elements) {
            result.add(element.toJavaValue());
        }
        return result;
    }

    @Override
    public boolean valueEquals(PulseValue other) {
        return other == this;
    }

    @Override
    protected PulseValue copyInto(Map<PulseValue, PulseValue> copies) {
        PulseValue existing = copies.get(this);
        if (existing != null) {
            return existing;
        }
        List<PulseValue> copy = new ArrayList<PulseValue>(elements.size());
        for (PulseValue element : elements) {
            copy.add(element.copyInto(copies));
        }
        PulseArray result = new PulseArray(elementType, copy);
        copies.put(this, result);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i));
        }
        return sb.append("]").toString();
    }
}
