package com.pulselang.compiler.ast.expr;

import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;
import com.pulselang.compiler.ast.TypeRef;

import java.util.List;

/**
 * 对象或数组创建
 *
 * <ul>
 *   <li>{@code new Sensor(a, b)}：type 为类名，args 为构造参数，arraySize 为 null</li>
 *   <li>{@code new int[n]}：type 为元素类型，arraySize 为长度表达式</li>
 * </ul>
 */
public class NewExpr extends Expression {
    private final TypeRef type;
    private final List<Expression> args;
    private final Expression arraySize;

    public NewExpr(SourceLocation location, TypeRef type, List<Expression> args, Expression arraySize) {
        super(location);
        this.type = type;
        this.args = args;
        this.arraySize = arraySize;
    }

    public TypeRef getType() {
        return type;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public Expression getArraySize() {
        return arraySize;
    }

    public boolean isArray() {
        return arraySize != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNewExpr(this, context);
    }
}
