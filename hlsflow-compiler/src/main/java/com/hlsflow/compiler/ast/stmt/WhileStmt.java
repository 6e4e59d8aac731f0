package com.hlsflow.compiler.ast.stmt;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.expr.Expression;

/**
 * While / do-while 语句
 */
public class WhileStmt extends Statement {
    private final Expression condition;
    private final Statement body;
    private final boolean doWhile;

    public WhileStmt(SourceLocation location, Expression condition, Statement body, boolean doWhile) {
        super(location);
        this.condition = condition;
        this.body = body;
        this.doWhile = doWhile;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getBody() {
        return body;
    }

    public boolean isDoWhile() {
        return doWhile;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }
}
