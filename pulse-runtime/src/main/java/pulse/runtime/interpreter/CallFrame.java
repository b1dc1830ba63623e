package pulse.runtime.interpreter;

import com.pulselang.compiler.ast.decl.ClassDecl;
import pulse.runtime.PulseObject;
import pulse.runtime.PulseValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 调用帧：所属类、接收者，以及本帧声明过的名称在进入前的绑定
 *
 * <p>参数和局部变量首次声明时记下被覆盖的绑定，退出时全部还原，
 * 因此递归调用不会破坏调用方的局部变量。</p>
 */
final class CallFrame {

    private final String label;
    private final ClassDecl owner;
    private final PulseObject receiver;
    private final Map<String, Environment.Binding> shadowed = new LinkedHashMap<String, Environment.Binding>();

    CallFrame(String label, ClassDecl owner, PulseObject receiver) {
        this.label = label;
        this.owner = owner;
        this.receiver = receiver;
    }

    /** 调用栈中显示的名称，如 {@code read[temperature]} */
    String getLabel() {
        return label;
    }

    ClassDecl getOwner() {
        return owner;
    }

    /** 静态调用时为 null */
    PulseObject getReceiver() {
        return receiver;
    }

    /**
     * 在本帧声明 name；首次声明时记录原绑定
     */
    void declare(String name, Environment env) {
        if (!shadowed.containsKey(name)) {
            shadowed.put(name, env.lookup(name));
        }
    }

    boolean declares(String name) {
        return shadowed.containsKey(name);
    }

    /**
     * 被本帧遮蔽、返回后会还原的值；它们仍然存活，收集时要作为根
     */
    List<PulseValue> shadowedValues() {
        List<PulseValue> values = new ArrayList<PulseValue>();
        for (Environment.Binding binding : shadowed.values()) {
            if (binding != null && binding.value != null) {
                values.add(binding.value);
            }
        }
        return values;
    }

    /**
     * 还原本帧覆盖的所有绑定
     */
    void restore(Environment env) {
        for (Map.Entry<String, Environment.Binding> entry : shadowed.entrySet()) {
            env.restore(entry.getKey(), entry.getValue());
        }
    }
}
