package com.pulselang.compiler.ast.decl;

import com.pulselang.compiler.ast.AstNode;
import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;
import com.pulselang.compiler.ast.TypeRef;

/**
 * 方法参数
 */
public class Parameter extends AstNode {
    private final TypeRef type;
    private final String name;

    public Parameter(SourceLocation location, TypeRef type, String name) {
        super(location);
        this.type = type;
        this.name = name;
    }

    public TypeRef getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
