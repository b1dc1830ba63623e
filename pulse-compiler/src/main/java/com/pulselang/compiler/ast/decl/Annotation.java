package com.pulselang.compiler.ast.decl;

import com.pulselang.compiler.ast.AstNode;
import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.Map;

/**
 * 注解
 *
 * <p>参数为 {@code name=value} 形式，值只能是字面量
 * （Integer、Double、String、Boolean）。</p>
 */
public class Annotation extends AstNode {

    public static final String DEADLINE = "Deadline";
    public static final String SENSOR = "Sensor";
    public static final String SAFETY_CHECK = "SafetyCheck";
    public static final String REAL_TIME = "RealTime";

    private final String name;
    private final Map<String, Object> args;

    public Annotation(SourceLocation location, String name, Map<String, Object> args) {
        super(location);
        this.name = name;
        this.args = Collections.unmodifiableMap(args);
    }

    public String getName() {
        return name;
    }

    /** 按声明顺序排列的参数 */
    public Map<String, Object> getArgs() {
        return args;
    }

    public Object getArg(String argName) {
        return args.get(argName);
    }

    public boolean hasArgs() {
        return !args.isEmpty();
    }

    /**
     * 读取整数参数
     *
     * @return 参数值；不存在或不是数字时返回 defaultValue
     */
    public long getLongArg(String argName, long defaultValue) {
        Object value = args.get(argName);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return defaultValue;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAnnotation(this, context);
    }
}
