package com.pulselang.compiler.ast.expr;

import com.pulselang.compiler.ast.AstNode;
import com.pulselang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
