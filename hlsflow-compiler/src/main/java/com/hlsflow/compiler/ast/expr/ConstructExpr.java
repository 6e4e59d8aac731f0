package com.hlsflow.compiler.ast.expr;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 临时对象构造 Type(args)，Type 为结构体或模板实例
 */
public class ConstructExpr extends Expression {
    private final TypeRef type;
    private final List<Expression> arguments;

    public ConstructExpr(SourceLocation location, TypeRef type, List<Expression> arguments) {
        super(location);
        this.type = type;
        this.arguments = arguments;
    }

    public TypeRef getType() {
        return type;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConstructExpr(this, context);
    }

    @Override
    public String toString() {
        return type.getSpelling() + "(...)";
    }
}
