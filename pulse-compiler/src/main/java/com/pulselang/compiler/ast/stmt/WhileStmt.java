package com.pulselang.compiler.ast.stmt;

import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;
import com.pulselang.compiler.ast.expr.Expression;

/**
 * While 循环
 */
public class WhileStmt extends Statement {
    private final Expression condition;
    private final Statement body;

    public WhileStmt(SourceLocation location, Expression condition, Statement body) {
        super(location);
        this.condition = condition;
        this.body = body;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }
}
