package com.hlsflow.compiler.ast.expr;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;

/**
 * 成员访问 obj.name / ptr-&gt;name
 */
public class MemberExpr extends Expression {
    private final Expression target;
    private final String member;
    private final boolean arrow;

    public MemberExpr(SourceLocation location, Expression target, String member, boolean arrow) {
        super(location);
        this.target = target;
        this.member = member;
        this.arrow = arrow;
    }

    public Expression getTarget() {
        return target;
    }

    public String getMember() {
        return member;
    }

    public boolean isArrow() {
        return arrow;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMemberExpr(this, context);
    }

    @Override
    public String toString() {
        return target + (arrow ? "->" : ".") + member;
    }
}
