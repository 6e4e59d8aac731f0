package com.hlsflow.compiler.ast.expr;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;

/**
 * 一元表达式
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, UnaryOp operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    @Override
    public String toString() {
        if (operator == UnaryOp.POST_INC || operator == UnaryOp.POST_DEC) {
            return operand + operator.toSourceString();
        }
        return operator.toSourceString() + operand;
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        PLUS("+"),
        NEG("-"),
        NOT("!"),
        BIT_NOT("~"),
        PRE_INC("++"),
        PRE_DEC("--"),
        POST_INC("++"),
        POST_DEC("--"),
        DEREF("*"),
        ADDRESS_OF("&");

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }

        public boolean isIncrementOrDecrement() {
            return this == PRE_INC || this == PRE_DEC || this == POST_INC || this == POST_DEC;
        }

        public boolean isPostfix() {
            return this == POST_INC || this == POST_DEC;
        }
    }
}
