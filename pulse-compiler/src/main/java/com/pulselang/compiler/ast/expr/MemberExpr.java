package com.pulselang.compiler.ast.expr;

import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;

/**
 * 成员访问：{@code target.name}
 */
public class MemberExpr extends Expression {
    private final Expression target;
    private final String name;

    public MemberExpr(SourceLocation location, Expression target, String name) {
        super(location);
        this.target = target;
        this.name = name;
    }

    public Expression getTarget() {
        return target;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMemberExpr(this, context);
    }
}
