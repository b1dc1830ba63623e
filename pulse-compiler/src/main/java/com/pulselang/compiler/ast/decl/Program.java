package com.pulselang.compiler.ast.decl;

import com.pulselang.compiler.ast.AstNode;
import com.pulselang.compiler.ast.AstVisitor;
import com.pulselang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 程序（编译单元）：类声明列表
 */
public class Program extends AstNode {
    private final List<ClassDecl> classes;

    public Program(SourceLocation location, List<ClassDecl> classes) {
        super(location);
        this.classes = classes;
    }

    public List<ClassDecl> getClasses() {
        return classes;
    }

    /** 按名称查找类，找不到返回 null */
    public ClassDecl findClass(String name) {
        for (ClassDecl cls : classes) {
            if (cls.getName().equals(name)) {
                return cls;
            }
        }
        return null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
