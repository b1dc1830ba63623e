package com.pulselang.compiler.ast.decl;

import com.pulselang.compiler.ast.AstNode;
import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.Modifier;
import com.pulselang.compiler.ast.SourceLocation;
import com.pulselang.compiler.ast.TypeRef;
import com.pulselang.compiler.ast.stmt.Block;

import java.util.List;

/**
 * 方法声明
 */
public class MethodDecl extends AstNode {
    private final List<Annotation> annotations;
    private final List<Modifier> modifiers;
    private final TypeRef returnType;
    private final String name;
    private final List<Parameter> params;
    private final Block body;

    public MethodDecl(SourceLocation location, List<Annotation> annotations, List<Modifier> modifiers,
                      TypeRef returnType, String name, List<Parameter> params, Block body) {
        super(location);
        this.annotations = annotations;
        this.modifiers = modifiers;
        this.returnType = returnType;
        this.name = name;
        this.params = params;
        this.body = body;
    }

    public List<Annotation> getAnnotations() {
        return annotations;
    }

    public List<Modifier> getModifiers() {
        return modifiers;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public Block getBody() {
        return body;
    }

    /** 查找指定名称的注解，没有返回 null */
    public Annotation findAnnotation(String annotationName) {
        for (Annotation annotation : annotations) {
            if (annotation.getName().equals(annotationName)) {
                return annotation;
            }
        }
        return null;
    }

    public boolean hasAnnotation(String annotationName) {
        return findAnnotation(annotationName) != null;
    }

    public boolean isStatic() {
        return modifiers.contains(Modifier.STATIC);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMethodDecl(this, context);
    }
}
