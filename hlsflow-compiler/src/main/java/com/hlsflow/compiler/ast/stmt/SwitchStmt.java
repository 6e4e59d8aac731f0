package com.hlsflow.compiler.ast.stmt;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.expr.Expression;

import java.util.List;

/**
 * Switch 语句
 */
public class SwitchStmt extends Statement {
    private final Expression scrutinee;
    private final List<SwitchSection> sections;

    public SwitchStmt(SourceLocation location, Expression scrutinee, List<SwitchSection> sections) {
        super(location);
        this.scrutinee = scrutinee;
        this.sections = sections;
    }

    public Expression getScrutinee() {
        return scrutinee;
    }

    public List<SwitchSection> getSections() {
        return sections;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSwitchStmt(this, context);
    }
}
