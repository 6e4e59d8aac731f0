package com.hlsflow.compiler.ast.decl;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.AstNode;
import com.hlsflow.compiler.ast.type.TypeRef;

/**
 * 模板形参：typename T 或 int N / bool B
 */
public class TemplateParameter extends AstNode {
    private final String name;
    /** 非类型形参的值类型；类型形参为 null */
    private final TypeRef valueType;

    public TemplateParameter(SourceLocation location, String name, TypeRef valueType) {
        super(location);
        this.name = name;
        this.valueType = valueType;
    }

    public String getName() {
        return name;
    }

    public TypeRef getValueType() {
        return valueType;
    }

    public boolean isTypeParameter() {
        return valueType == null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTemplateParameter(this, context);
    }
}
