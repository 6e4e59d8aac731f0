package com.hlsflow.compiler.ast.stmt;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 变量声明语句（可含多个声明符）
 */
public class DeclStmt extends Statement {
    private final List<VarDecl> variables;

    public DeclStmt(SourceLocation location, List<VarDecl> variables) {
        super(location);
        this.variables = variables;
    }

    public List<VarDecl> getVariables() {
        return variables;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDeclStmt(this, context);
    }
}
