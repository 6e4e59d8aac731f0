package com.hlsflow.compiler.ast.decl;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.stmt.VarDecl;

import java.util.Collections;

/**
 * 命名空间作用域的变量声明（仅支持编译期常量）
 */
public class GlobalVarDecl extends Declaration {
    private final VarDecl variable;

    public GlobalVarDecl(SourceLocation location, VarDecl variable) {
        super(location, variable.getName(), Collections.emptyList());
        this.variable = variable;
    }

    public VarDecl getVariable() {
        return variable;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGlobalVarDecl(this, context);
    }
}
