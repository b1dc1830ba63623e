package pulse.runtime;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * PulseLang 运行时值的基类
 *
 * <p>除 {@link PulseObject} 外所有值都不可变。每次绑定产生新的实例，
 * 垃圾收集器按引用同一性判断可达性，因此这里不做实例缓存。</p>
 */
public abstract class PulseValue {

    /**
     * 类型名，与源码中的类型名一致（int、double、String、int[]、类名）
     */
    public abstract String getTypeName();

    /**
     * 名义大小（字节），用于堆记账
     */
    public abstract int getSize();

    /**
     * 转换为 Java 值，用于快照展示和 JSON 输出
     */
    public abstract Object toJavaValue();

    public boolean isNull() {
        return false;
    }

    public boolean isNumber() {
        return false;
    }

    public boolean isString() {
        return false;
    }

    /**
     * 值相等（{@code ==} 语义）：数值提升后比较，字符串比较内容，
     * 对象比较引用
     */
    public abstract boolean valueEquals(PulseValue other);

    /**
     * 快照用的深拷贝；不可变值直接返回自身
     */
    public final PulseValue deepCopy() {
        return copyInto(new IdentityHashMap<PulseValue, PulseValue>());
    }

    /**
     * 深拷贝实现，copies 记录已复制的实例以保留共享和环
     */
    protected PulseValue copyInto(Map<PulseValue, PulseValue> copies) {
        return this;
    }

    /**
     * 用于 println 和字符串拼接的文本形式
     */
    @Override
    public abstract String toString();
}
