package com.hlsflow.compiler.ast.decl;

import com.hlsflow.compiler.ast.AstNode;
import com.hlsflow.compiler.ast.Pragma;
import com.hlsflow.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 声明基类
 */
public abstract class Declaration extends AstNode {
    protected final String name;
    protected final List<Pragma> pragmas;

    protected Declaration(SourceLocation location, String name, List<Pragma> pragmas) {
        super(location);
        this.name = name;
        this.pragmas = pragmas;
    }

    public String getName() {
        return name;
    }

    public List<Pragma> getPragmas() {
        return pragmas;
    }

    public boolean hasPragma(String pragmaName) {
        return Pragma.contains(pragmas, pragmaName);
    }
}
