package com.pulselang.compiler.ast.expr;

import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 调用表达式：{@code f(x)}、{@code obj.m(x)}、{@code System.out.println(x)}
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, Expression callee, List<Expression> args) {
        super(location);
        this.callee = callee;
        this.args = args;
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    /**
     * 被调用者的点分路径，如 {@code System.out.println}；
     * 被调用者不是纯名称链时返回 null
     */
    public String getCalleePath() {
        return pathOf(callee);
    }

    private static String pathOf(Expression expr) {
        if (expr instanceof Identifier) {
            return ((Identifier) expr).getName();
        }
        if (expr instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) expr;
            String target = pathOf(member.getTarget());
            return target != null ? target + "." + member.getName() : null;
        }
        return null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
