package com.hlsflow.compiler.ast.type;

import com.hlsflow.compiler.ast.AstNode;
import com.hlsflow.compiler.ast.SourceLocation;

/**
 * 类型引用基类，携带 const 与引用限定
 */
public abstract class TypeRef extends AstNode {
    protected final boolean constQualified;
    protected final boolean reference;

    protected TypeRef(SourceLocation location, boolean constQualified, boolean reference) {
        super(location);
        this.constQualified = constQualified;
        this.reference = reference;
    }

    public boolean isConst() {
        return constQualified;
    }

    public boolean isReference() {
        return reference;
    }

    /** 返回带新限定符的副本 */
    public abstract TypeRef withQualifiers(boolean constQualified, boolean reference);

    /** 不含限定符的类型拼写 */
    public abstract String getSpelling();

    @Override
    public String toString() {
        return (constQualified ? "const " : "") + getSpelling() + (reference ? "&" : "");
    }
}
