package com.hlsflow.compiler.ast.expr;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;

/**
 * this 表达式（指针语义，通过 -> 或 *this 使用）
 */
public class ThisExpr extends Expression {

    public ThisExpr(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitThisExpr(this, context);
    }

    @Override
    public String toString() {
        return "this";
    }
}
