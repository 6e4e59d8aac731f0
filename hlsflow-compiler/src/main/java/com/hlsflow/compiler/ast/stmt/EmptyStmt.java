package com.hlsflow.compiler.ast.stmt;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;

/**
 * 空语句（单独的分号）
 */
public class EmptyStmt extends Statement {

    public EmptyStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEmptyStmt(this, context);
    }
}
