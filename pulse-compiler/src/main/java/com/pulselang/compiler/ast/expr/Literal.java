package com.pulselang.compiler.ast.expr;

import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;

/**
 * 字面量表达式
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    /** Integer / Double / String / Boolean，NULL 时为 null */
    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    /** 是否为数值零（{@code 0} 或 {@code 0.0}） */
    public boolean isZero() {
        if (kind == LiteralKind.INT) {
            return ((Integer) value).intValue() == 0;
        }
        if (kind == LiteralKind.DOUBLE) {
            return ((Double) value).doubleValue() == 0.0;
        }
        return false;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT,
        DOUBLE,
        STRING,
        BOOLEAN,
        NULL
    }
}
