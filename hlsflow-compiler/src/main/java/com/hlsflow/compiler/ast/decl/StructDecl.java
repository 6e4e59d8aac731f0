package com.hlsflow.compiler.ast.decl;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.Pragma;
import com.hlsflow.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * struct / class 声明
 */
public class StructDecl extends Declaration {
    private final boolean isClass;
    private final List<TemplateParameter> templateParameters;
    private final List<BaseSpecifier> bases;
    private final List<FieldDecl> fields;
    private final List<FunctionDecl> methods;

    public StructDecl(SourceLocation location, String name, List<Pragma> pragmas, boolean isClass,
                      List<TemplateParameter> templateParameters, List<BaseSpecifier> bases,
                      List<FieldDecl> fields, List<FunctionDecl> methods) {
        super(location, name, pragmas);
        this.isClass = isClass;
        this.templateParameters = templateParameters;
        this.bases = bases;
        this.fields = fields;
        this.methods = methods;
    }

    /** 以新名字复制（用于 typedef struct { ... } Name;） */
    public StructDecl renamed(String newName, List<Pragma> extraPragmas) {
        List<Pragma> merged = new ArrayList<>(pragmas);
        merged.addAll(extraPragmas);
        return new StructDecl(location, newName, merged, isClass, templateParameters, bases, fields, methods);
    }

    public boolean isClass() {
        return isClass;
    }

    public boolean isAnonymous() {
        return name == null;
    }

    public List<TemplateParameter> getTemplateParameters() {
        return templateParameters;
    }

    public boolean isTemplate() {
        return !templateParameters.isEmpty();
    }

    public List<BaseSpecifier> getBases() {
        return bases;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    public List<FunctionDecl> getMethods() {
        return methods;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructDecl(this, context);
    }
}
