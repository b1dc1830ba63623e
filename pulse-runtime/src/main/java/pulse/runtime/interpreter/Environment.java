package pulse.runtime.interpreter;

import com.pulselang.compiler.ast.TypeRef;
import pulse.runtime.PulseValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次运行的扁平变量环境：按插入顺序的名称到值映射，并记录每个名称的声明类型
 *
 * <p>没有嵌套作用域。方法调用时参数覆盖同名绑定，退出时通过
 * {@link #lookup} / {@link #restore} 还原之前的绑定。</p>
 */
final class Environment {

    /**
     * 一个绑定：声明类型和当前值
     */
    static final class Binding {
        final TypeRef type;
        final PulseValue value;

        Binding(TypeRef type, PulseValue value) {
            this.type = type;
            this.value = value;
        }
    }

    private final Map<String, Binding> bindings = new LinkedHashMap<String, Binding>();

    /**
     * 声明（或重新声明）变量，值应已按类型转换
     */
    void define(String name, TypeRef type, PulseValue value) {
        bindings.put(name, new Binding(type, value));
    }

    /**
     * 给已声明的变量赋值，保留声明类型
     */
    void assign(String name, PulseValue value) {
        Binding binding = bindings.get(name);
        if (binding == null) {
            throw new IllegalStateException("Variable not defined: " + name);
        }
        bindings.put(name, new Binding(binding.type, value));
    }

    boolean isDefined(String name) {
        return bindings.containsKey(name);
    }

    /** 未定义时返回 null */
    PulseValue get(String name) {
        Binding binding = bindings.get(name);
        return binding != null ? binding.value : null;
    }

    /** 未定义时返回 null */
    TypeRef typeOf(String name) {
        Binding binding = bindings.get(name);
        return binding != null ? binding.type : null;
    }

    /** 当前绑定；未定义时返回 null */
    Binding lookup(String name) {
        return bindings.get(name);
    }

    /**
     * 还原 {@link #lookup} 取得的绑定；previous 为 null 表示之前未定义，删除该名称
     */
    void restore(String name, Binding previous) {
        if (previous == null) {
            bindings.remove(name);
        } else {
            bindings.put(name, previous);
        }
    }

    /** 按声明顺序的名称到值副本 */
    Map<String, PulseValue> snapshot() {
        Map<String, PulseValue> result = new LinkedHashMap<String, PulseValue>();
        for (Map.Entry<String, Binding> entry : bindings.entrySet()) {
            result.put(entry.getKey(), entry.getValue().value);
        }
        return result;
    }

    /** 所有绑定的值，作为垃圾收集的根 */
    Collection<PulseValue> values() {
        List<PulseValue> result = new ArrayList<PulseValue>(bindings.size());
        for (Binding binding : bindings.values()) {
            result.add(binding.value);
        }
        return result;
    }

    int size() {
        return bindings.size();
    }

    void clear() {
        bindings.clear();
    }
}
