package com.hlsflow.compiler.ast.decl;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.Pragma;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.stmt.CompoundStmt;
import com.hlsflow.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 函数声明：自由函数、方法、构造函数、转换运算符与运算符重载
 */
public class FunctionDecl extends Declaration {

    public enum Kind {
        FUNCTION, METHOD, CONSTRUCTOR, CONVERSION
    }

    private final Kind kind;
    private final TypeRef returnType;
    private final List<ParamDecl> parameters;
    private final CompoundStmt body;           // 仅声明时为 null
    private final List<TemplateParameter> templateParameters;
    private final List<MemberInitializer> memberInitializers;
    private final boolean isStatic;
    private final boolean constMethod;

    public FunctionDecl(SourceLocation location, String name, List<Pragma> pragmas, Kind kind,
                        TypeRef returnType, List<ParamDecl> parameters, CompoundStmt body,
                        List<TemplateParameter> templateParameters,
                        List<MemberInitializer> memberInitializers,
                        boolean isStatic, boolean constMethod) {
        super(location, name, pragmas);
        this.kind = kind;
        this.returnType = returnType;
        this.parameters = parameters;
        this.body = body;
        this.templateParameters = templateParameters;
        this.memberInitializers = memberInitializers;
        this.isStatic = isStatic;
        this.constMethod = constMethod;
    }

    public Kind getKind() {
        return kind;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public List<ParamDecl> getParameters() {
        return parameters;
    }

    public CompoundStmt getBody() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    public List<TemplateParameter> getTemplateParameters() {
        return templateParameters;
    }

    public boolean isTemplate() {
        return !templateParameters.isEmpty();
    }

    public List<MemberInitializer> getMemberInitializers() {
        return memberInitializers;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public boolean isConstMethod() {
        return constMethod;
    }

    public boolean isConstructor() {
        return kind == Kind.CONSTRUCTOR;
    }

    public boolean isOperator() {
        return name.startsWith("operator");
    }

    /** 至少需要的实参数（去掉带默认值的尾部参数） */
    public int getRequiredParameterCount() {
        int n = 0;
        for (ParamDecl p : parameters) {
            if (!p.hasDefaultValue()) {
                n++;
            }
        }
        return n;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }
}
