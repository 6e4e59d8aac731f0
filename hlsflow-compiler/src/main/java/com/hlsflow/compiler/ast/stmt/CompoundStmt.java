package com.hlsflow.compiler.ast.stmt;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 复合语句（花括号块）
 */
public class CompoundStmt extends Statement {
    private final List<Statement> statements;

    public CompoundStmt(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = statements;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCompoundStmt(this, context);
    }
}
