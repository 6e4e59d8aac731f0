package com.hlsflow.compiler.ast.expr;

import com.hlsflow.compiler.ast.AstNode;
import com.hlsflow.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {
    protected Expression(SourceLocation location) {
        super(location);
    }
}
