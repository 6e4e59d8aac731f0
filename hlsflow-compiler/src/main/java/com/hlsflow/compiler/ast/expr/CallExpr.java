package com.hlsflow.compiler.ast.expr;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 函数 / 方法调用。callee 为 NameExpr（自由函数、静态方法、隐式 this 方法）
 * 或 MemberExpr（obj.method / ptr-&gt;method）。
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> arguments;

    public CallExpr(SourceLocation location, Expression callee, List<Expression> arguments) {
        super(location);
        this.callee = callee;
        this.arguments = arguments;
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }

    @Override
    public String toString() {
        return callee + "(...)";
    }
}
