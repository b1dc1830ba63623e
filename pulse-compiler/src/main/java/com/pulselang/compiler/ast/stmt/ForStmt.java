package com.pulselang.compiler.ast.stmt;

import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;
import com.pulselang.compiler.ast.expr.Expression;

/**
 * C 风格 for 循环：{@code for (init; condition; update) body}
 */
public class ForStmt extends Statement {
    private final Statement init;          // 可选：VarDeclStmt 或 ExpressionStmt
    private final Expression condition;    // 可选，缺省为 true
    private final Expression update;       // 可选
    private final Statement body;

    public ForStmt(SourceLocation location, Statement init, Expression condition,
                   Expression update, Statement body) {
        super(location);
        this.init = init;
        this.condition = condition;
        this.update = update;
        this.body = body;
    }

    public Statement getInit() {
        return init;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getUpdate() {
        return update;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
