package com.hlsflow.compiler.ast.decl;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 命名空间声明
 */
public class NamespaceDecl extends Declaration {
    private final List<Declaration> declarations;

    public NamespaceDecl(SourceLocation location, String name, List<Declaration> declarations) {
        super(location, name, Collections.emptyList());
        this.declarations = declarations;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNamespaceDecl(this, context);
    }
}
