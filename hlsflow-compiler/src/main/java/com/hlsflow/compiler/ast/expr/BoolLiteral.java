package com.hlsflow.compiler.ast.expr;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;

/**
 * true / false
 */
public class BoolLiteral extends Expression {
    private final boolean value;

    public BoolLiteral(SourceLocation location, boolean value) {
        super(location);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBoolLiteral(this, context);
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
