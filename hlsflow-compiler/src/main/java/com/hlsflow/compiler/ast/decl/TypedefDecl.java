package com.hlsflow.compiler.ast.decl;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.type.TypeRef;

import java.util.Collections;

/**
 * typedef / using 别名
 */
public class TypedefDecl extends Declaration {
    private final TypeRef aliasedType;

    public TypedefDecl(SourceLocation location, String name, TypeRef aliasedType) {
        super(location, name, Collections.emptyList());
        this.aliasedType = aliasedType;
    }

    public TypeRef getAliasedType() {
        return aliasedType;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypedefDecl(this, context);
    }
}
