package com.hlsflow.compiler.ast.decl;

import com.hlsflow.compiler.ast.type.TypeRef;

/**
 * 基类说明：: public Base
 */
public final class BaseSpecifier {
    private final TypeRef type;
    private final boolean virtual;

    public BaseSpecifier(TypeRef type, boolean virtual) {
        this.type = type;
        this.virtual = virtual;
    }

    public TypeRef getType() {
        return type;
    }

    public boolean isVirtual() {
        return virtual;
    }
}
