package com.hlsflow.compiler.ast.decl;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.expr.Expression;
import com.hlsflow.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 结构体字段
 */
public class FieldDecl extends Declaration {
    private final TypeRef type;
    private final List<Expression> arrayDimensions;
    private final Expression initializer;  // 默认成员初始化，可选
    private final boolean isStatic;

    public FieldDecl(SourceLocation location, String name, TypeRef type, List<Expression> arrayDimensions,
                     Expression initializer, boolean isStatic) {
        super(location, name, Collections.emptyList());
        this.type = type;
        this.arrayDimensions = arrayDimensions;
        this.initializer = initializer;
        this.isStatic = isStatic;
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

    public boolean isStatic() {
        return isStatic;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldDecl(this, context);
    }
}
