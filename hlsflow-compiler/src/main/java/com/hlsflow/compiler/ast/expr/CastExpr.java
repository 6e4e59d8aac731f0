package com.hlsflow.compiler.ast.expr;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.type.TypeRef;

/**
 * 内置类型转换：(T)e、T(e)、static_cast&lt;T&gt;(e)
 */
public class CastExpr extends Expression {

    public enum Style {
        C_STYLE, FUNCTIONAL, STATIC_CAST
    }

    private final TypeRef targetType;
    private final Expression operand;
    private final Style style;

    public CastExpr(SourceLocation location, TypeRef targetType, Expression operand, Style style) {
        super(location);
        this.targetType = targetType;
        this.operand = operand;
        this.style = style;
    }

    public TypeRef getTargetType() {
        return targetType;
    }

    public Expression getOperand() {
        return operand;
    }

    public Style getStyle() {
        return style;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCastExpr(this, context);
    }

    @Override
    public String toString() {
        return "(" + targetType + ")" + operand;
    }
}
