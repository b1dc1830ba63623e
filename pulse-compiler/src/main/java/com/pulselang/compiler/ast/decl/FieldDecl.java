package com.pulselang.compiler.ast.decl;

import com.pulselang.compiler.ast.AstNode;
import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.Modifier;
import com.pulselang.compiler.ast.SourceLocation;
import com.pulselang.compiler.ast.TypeRef;
import com.pulselang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 字段声明
 */
public class FieldDecl extends AstNode {
    private final List<Annotation> annotations;
    private final List<Modifier> modifiers;
    private final TypeRef type;
    private final String name;
    private final Expression initializer;  // 可选

    public FieldDecl(SourceLocation location, List<Annotation> annotations, List<Modifier> modifiers,
                     TypeRef type, String name, Expression initializer) {
        super(location);
        this.annotations = annotations;
        this.modifiers = modifiers;
        this.type = type;
        this.name = name;
        this.initializer = initializer;
    }

    public List<Annotation> getAnnotations() {
        return annotations;
    }

    public List<Modifier> getModifiers() {
        return modifiers;
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
        return visitor.visitFieldDecl(this, context);
    }
}
