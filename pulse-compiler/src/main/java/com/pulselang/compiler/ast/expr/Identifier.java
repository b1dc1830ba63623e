package com.pulselang.compiler.ast.expr;

import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;

/**
 * 标识符引用（{@code this} 也解析为名为 "this" 的标识符）
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
