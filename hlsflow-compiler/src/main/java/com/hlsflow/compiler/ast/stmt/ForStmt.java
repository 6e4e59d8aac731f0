package com.hlsflow.compiler.ast.stmt;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.Pragma;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.expr.Expression;

import java.util.List;

/**
 * For 语句，三个子句均可缺省
 */
public class ForStmt extends Statement {
    private final List<Pragma> pragmas;
    private final Statement initializer;  // DeclStmt 或 ExprStmt，可选
    private final Expression condition;   // 可选
    private final Expression update;      // 可选
    private final Statement body;

    public ForStmt(SourceLocation location, List<Pragma> pragmas, Statement initializer,
                   Expression condition, Expression update, Statement body) {
        super(location);
        this.pragmas = pragmas;
        this.initializer = initializer;
        this.condition = condition;
        this.update = update;
        this.body = body;
    }

    public List<Pragma> getPragmas() {
        return pragmas;
    }

    public Statement getInitializer() {
        return initializer;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getUpdate() {
        return update;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
