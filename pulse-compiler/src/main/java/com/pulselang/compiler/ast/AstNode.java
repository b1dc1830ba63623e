package com.pulselang.compiler.ast;

/**
 * AST 节点基类
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 节点所在行（位置未知时为 0） */
    public int getLine() {
        return location != null ? location.getLine() : 0;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
