package com.hlsflow.compiler.ast.expr;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 花括号初始化列表 {a, b, {c, d}}
 */
public class InitListExpr extends Expression {
    private final List<Expression> elements;

    public InitListExpr(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = elements;
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitInitListExpr(this, context);
    }

    @Override
    public String toString() {
        return "{...}";
    }
}
