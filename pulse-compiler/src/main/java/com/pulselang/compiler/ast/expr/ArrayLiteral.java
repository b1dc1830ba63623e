package com.pulselang.compiler.ast.expr;

import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 数组初始化器 {@code {1, 2, 3}}，仅出现在声明的初始值位置
 */
public class ArrayLiteral extends Expression {
    private final List<Expression> elements;

    public ArrayLiteral(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = elements;
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayLiteral(this, context);
    }
}
