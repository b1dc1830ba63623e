package com.pulselang.compiler.ast.stmt;

import com.pulselang.compiler.ast.AstNode;
import com.pulselang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
