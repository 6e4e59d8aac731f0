package com.hlsflow.compiler.ast.stmt;

import com.hlsflow.compiler.ast.AstNode;
import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.expr.Expression;
import com.hlsflow.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 单个变量声明符：T x; T x = e; T x(args); T x[N] = {...};
 */
public class VarDecl extends AstNode {
    private final String name;
    private final TypeRef type;
    private final List<Expression> arrayDimensions;
    private final Expression initializer;           // = 之后的表达式，可选
    private final List<Expression> constructorArguments; // 直接初始化 x(args)，无则为 null
    private final boolean isStatic;

    public VarDecl(SourceLocation location, String name, TypeRef type, List<Expression> arrayDimensions,
                   Expression initializer, List<Expression> constructorArguments, boolean isStatic) {
        super(location);
        this.name = name;
        this.type = type;
        this.arrayDimensions = arrayDimensions;
        this.initializer = initializer;
        this.constructorArguments = constructorArguments;
        this.isStatic = isStatic;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public List<Expression> getArrayDimensions() {
        return arrayDimensions;
    }

    public Expression getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    public List<Expression> getConstructorArguments() {
        return constructorArguments;
    }

    public boolean hasConstructorArguments() {
        return constructorArguments != null;
    }

    public boolean isStatic() {
        return isStatic;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarDecl(this, context);
    }
}
