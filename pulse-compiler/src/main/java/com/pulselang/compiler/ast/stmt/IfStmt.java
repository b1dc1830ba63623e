package com.pulselang.compiler.ast.stmt;

import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;
import com.pulselang.compiler.ast.expr.Expression;

/**
 * If 语句
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final Statement thenBranch;
    private final Statement elseBranch;  // 可选

    public IfStmt(SourceLocation location, Expression condition,
                  Statement thenBranch, Statement elseBranch) {
        super(location);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getThenBranch() {
        return thenBranch;
    }

    public Statement getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
