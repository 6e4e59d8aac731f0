package com.hlsflow.compiler.ast.type;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.QualifiedName;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 具名类型（结构体、typedef、模板实例，如 TestX&lt;int&gt;）
 */
public final class NamedType extends TypeRef {
    private final QualifiedName name;
    private final List<TemplateArgument> templateArguments;

    public NamedType(SourceLocation location, QualifiedName name, List<TemplateArgument> templateArguments,
                     boolean constQualified, boolean reference) {
        super(location, constQualified, reference);
        this.name = name;
        this.templateArguments = templateArguments != null ? templateArguments : Collections.<TemplateArgument>emptyList();
    }

    public QualifiedName getName() {
        return name;
    }

    public List<TemplateArgument> getTemplateArguments() {
        return templateArguments;
    }

    public boolean hasTemplateArguments() {
        return !templateArguments.isEmpty();
    }

    @Override
    public TypeRef withQualifiers(boolean constQualified, boolean reference) {
        return new NamedType(location, name, templateArguments, constQualified, reference);
    }

    @Override
    public String getSpelling() {
        if (templateArguments.isEmpty()) {
            return name.toString();
        }
        return name + "<" + templateArguments.stream()
                .map(TemplateArgument::toString)
                .collect(Collectors.joining(", ")) + ">";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNamedType(this, context);
    }
}
