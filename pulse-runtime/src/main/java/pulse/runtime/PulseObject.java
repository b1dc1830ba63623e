package pulse.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code new ClassName()} 产生的对象实例
 *
 * <p>唯一可变的值：字段赋值直接修改实例。嵌套对象在文本形式中只显示类名。名义大小固定为 16 字节，
 * 字段值作为独立绑定单独记账。</p>
 */
public final class PulseObject extends PulseValue {

    private static final int OBJECT_SIZE = 16;

    private final String className;
    private final Map<String, PulseValue> fields = new LinkedHashMap<String, PulseValue>();

    public PulseObject(String className) {
        this.className = className;
    }

    public String getClassName() {
        return className;
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public PulseValue getField(String name) {
        return fields.get(name);
    }

    public void setField(String name, PulseValue value) {
        fields.put(name, value);
    }

    public Map<String, PulseValue> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public String getTypeName() {
        return className;
    }

    @Override
    public int getSize() {
        return OBJECT_SIZE;
    }

    @Override
    public Object toJavaValue() {
        Map<String, Object> result = new LinkedHashMap<String, Object>();
        for (Map.Entry<String, PulseValue> entry : fields.entrySet()) {
            PulseValue value = entry.getValue();
            // 嵌套对象只展开一层，避免环
            result.put(entry.getKey(), value instanceof PulseObject
                    ? "<" + ((PulseObject) value).className + ">" : value.toJavaValue());
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
        PulseObject copy = new PulseObject(className);
        // 先登记再复制字段，环形引用指回副本
        copies.put(this, copy);
        for (Map.Entry<String, PulseValue> entry : fields.entrySet()) {
            copy.fields.put(entry.getKey(), entry.getValue().copyInto(copies));
        }
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(className).append("{");
        boolean first = true;
        for (Map.Entry<String, PulseValue> entry : fields.entrySet()) {
            if (!first) sb.append(", ");
            first = false;
            PulseValue value = entry.getValue();
            sb.append(entry.getKey()).append("=");
            if (value instanceof PulseObject) {
                sb.append(((PulseObject) value).className);
            } else {
                sb.append(value);
            }
        }
        return sb.append("}").toString();
    }
}
