package com.hlsflow.compiler.ast.expr;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;

/**
 * 赋值与复合赋值（a = b, a += b, ...）
 */
public class AssignExpr extends Expression {
    private final Expression target;
    private final BinaryExpr.BinaryOp compoundOperator;  // 简单赋值为 null
    private final Expression value;

    public AssignExpr(SourceLocation location, Expression target, BinaryExpr.BinaryOp compoundOperator,
                      Expression value) {
        super(location);
        this.target = target;
        this.compoundOperator = compoundOperator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public BinaryExpr.BinaryOp getCompoundOperator() {
        return compoundOperator;
    }

    public boolean isCompound() {
        return compoundOperator != null;
    }

    public Expression getValue() {
        return value;
    }

    /** 运算符拼写，如 "=" 或 "+=" */
    public String getOperatorSpelling() {
        return compoundOperator == null ? "=" : compoundOperator.toSourceString() + "=";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignExpr(this, context);
    }

    @Override
    public String toString() {
        return target + " " + getOperatorSpelling() + " " + value;
    }
}
