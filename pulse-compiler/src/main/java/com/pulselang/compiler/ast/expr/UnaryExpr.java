package com.pulselang.compiler.ast.expr;

import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;

/**
 * 一元表达式（含前缀/后缀自增自减）
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;
    private final boolean isPrefix;

    public UnaryExpr(SourceLocation location, UnaryOp operator, Expression operand, boolean isPrefix) {
        super(location);
        this.operator = operator;
        this.operand = operand;
        this.isPrefix = isPrefix;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    public boolean isPrefix() {
        return isPrefix;
    }

    public boolean isPostfix() {
        return !isPrefix;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        NEG("-"),
        NOT("!"),
        INC("++"),
        DEC("--");

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        /** 是否需要可赋值的操作数 */
        public boolean isMutating() {
            return this == INC || this == DEC;
        }
    }
}
