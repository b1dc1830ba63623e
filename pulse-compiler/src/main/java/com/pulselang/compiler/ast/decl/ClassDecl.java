package com.pulselang.compiler.ast.decl;

import com.pulselang.compiler.ast.AstNode;
import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.Modifier;
import com.pulselang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 类声明
 */
public class ClassDecl extends AstNode {

    /** 顶层方法和语句归并到的合成类名 */
    public static final String SYNTHETIC_NAME = "Main";

    private final List<Annotation> annotations;
    private final List<Modifier> modifiers;
    private final String name;
    private final List<FieldDecl> fields;
    private final List<MethodDecl> methods;
    private final boolean synthetic;

    public ClassDecl(SourceLocation location, List<Annotation> annotations, List<Modifier> modifiers,
                     String name, List<FieldDecl> fields, List<MethodDecl> methods, boolean synthetic) {
        super(location);
        this.annotations = annotations;
        this.modifiers = modifiers;
        this.name = name;
        this.fields = fields;
        this.methods = methods;
        this.synthetic = synthetic;
    }

    public List<Annotation> getAnnotations() {
        return annotations;
    }

    public List<Modifier> getModifiers() {
        return modifiers;
    }

    public String getName() {
        return name;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    public List<MethodDecl> getMethods() {
        return methods;
    }

    /** 是否为顶层代码合成的类 */
    public boolean isSynthetic() {
        return synthetic;
    }

    /** 按名称和参数个数查找方法 */
    public MethodDecl findMethod(String methodName, int arity) {
        for (MethodDecl method : methods) {
            if (method.getName().equals(methodName) && method.getParams().size() == arity) {
                return method;
            }
        }
        return null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClassDecl(this, context);
    }
}
