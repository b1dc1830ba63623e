package com.pulselang.compiler.ast.expr;

import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;

/**
 * 赋值表达式，目标为 {@link Identifier}、{@link IndexExpr} 或 {@link MemberExpr}
 */
public class AssignExpr extends Expression {
    private final Expression target;
    private final Expression value;

    public AssignExpr(SourceLocation location, Expression target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignExpr(this, context);
    }
}
