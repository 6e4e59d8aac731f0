package com.hlsflow.compiler.ast.expr;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.QualifiedName;
import com.hlsflow.compiler.ast.type.TemplateArgument;

import java.util.Collections;
import java.util.List;

/**
 * 名称引用（变量、函数、Type::static_method、f&lt;5&gt;）
 */
public class NameExpr extends Expression {
    private final QualifiedName name;
    private final List<TemplateArgument> templateArguments;

    public NameExpr(SourceLocation location, QualifiedName name, List<TemplateArgument> templateArguments) {
        super(location);
        this.name = name;
        this.templateArguments = templateArguments != null ? templateArguments : Collections.<TemplateArgument>emptyList();
    }

    public NameExpr(SourceLocation location, String simpleName) {
        this(location, QualifiedName.of(simpleName), null);
    }

    public QualifiedName getName() {
        return name;
    }

    public List<TemplateArgument> getTemplateArguments() {
        return templateArguments;
    }

    public boolean isSimple() {
        return !name.isQualified() && templateArguments.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNameExpr(this, context);
    }

    @Override
    public String toString() {
        return name.toString();
    }
}
