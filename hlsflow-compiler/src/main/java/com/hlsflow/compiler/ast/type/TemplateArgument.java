package com.hlsflow.compiler.ast.type;

import com.hlsflow.compiler.ast.expr.Expression;

/**
 * 模板实参：类型或常量表达式，二者取其一
 */
public final class TemplateArgument {
    private final TypeRef type;
    private final Expression value;

    private TemplateArgument(TypeRef type, Expression value) {
        this.type = type;
        this.value = value;
    }

    public static TemplateArgument ofType(TypeRef type) {
        return new TemplateArgument(type, null);
    }

    public static TemplateArgument ofValue(Expression value) {
        return new TemplateArgument(null, value);
    }

    public boolean isType() {
        return type != null;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public String toString() {
        return type != null ? type.toString() : String.valueOf(value);
    }
}
