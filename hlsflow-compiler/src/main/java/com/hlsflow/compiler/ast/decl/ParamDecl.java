package com.hlsflow.compiler.ast.decl;

import com.hlsflow.compiler.ast.AstNode;
import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.expr.Expression;
import com.hlsflow.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 函数参数
 */
public class ParamDecl extends AstNode {
    private final String name;
    private final TypeRef type;
    private final List<Expression> arrayDimensions;
    private final Expression defaultValue;  // 可选

    public ParamDecl(SourceLocation location, String name, TypeRef type,
                     List<Expression> arrayDimensions, Expression defaultValue) {
        super(location);
        this.name = name;
        this.type = type;
        this.arrayDimensions = arrayDimensions;
        this.defaultValue = defaultValue;
    }

    /** 未命名参数返回 null */
    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public List<Expression> getArrayDimensions() {
        return arrayDimensions;
    }

    public boolean isArray() {
        return !arrayDimensions.isEmpty();
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParamDecl(this, context);
    }
}
