package com.hlsflow.compiler.ast.stmt;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.Declaration;

/**
 * 函数体内的类型声明（如局部 struct）
 */
public class TypeDeclStmt extends Statement {
    private final Declaration declaration;

    public TypeDeclStmt(SourceLocation location, Declaration declaration) {
        super(location);
        this.declaration = declaration;
    }

    public Declaration getDeclaration() {
        return declaration;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeDeclStmt(this, context);
    }
}
