package com.hlsflow.compiler.ast.stmt;

import com.hlsflow.compiler.ast.AstNode;
import com.hlsflow.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {
    protected Statement(SourceLocation location) {
        super(location);
    }
}
