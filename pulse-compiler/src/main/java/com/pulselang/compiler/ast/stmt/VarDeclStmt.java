package com.pulselang.compiler.ast.stmt;

import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;
import com.pulselang.compiler.ast.TypeRef;
import com.pulselang.compiler.ast.expr.Expression;

/**
 * 局部变量声明：{@code int x = 1;}
 */
public class VarDeclStmt extends Statement {
    private final TypeRef type;
    private final String name;
    private final Expression initializer;  // 可选

    public VarDeclStmt(SourceLocation location, TypeRef type, String name, Expression initializer) {
        super(location);
        this.type = type;
        this.name = name;
        this.initializer = initializer;
    }

    public TypeRef getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarDeclStmt(this, context);
    }
}
