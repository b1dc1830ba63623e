package com.pulselang.compiler.ast.expr;

import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;

/**
 * 数组下标访问：{@code target[index]}
 */
public class IndexExpr extends Expression {
    private final Expression target;
    private final Expression index;

    public IndexExpr(SourceLocation location, Expression target, Expression index) {
        super(location);
        this.target = target;
        this.index = index;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexExpr(this, context);
    }
}
