package com.hlsflow.translator.types;

import com.hlsflow.compiler.ast.Pragma;
import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.decl.BaseSpecifier;
import com.hlsflow.compiler.ast.decl.FieldDecl;
import com.hlsflow.compiler.ast.decl.QualifiedName;
import com.hlsflow.compiler.ast.decl.StructDecl;
import com.hlsflow.compiler.ast.decl.TemplateParameter;
import com.hlsflow.compiler.ast.decl.TypedefDecl;
import com.hlsflow.compiler.ast.expr.Expression;
import com.hlsflow.compiler.ast.type.BuiltinNames;
import com.hlsflow.compiler.ast.type.BuiltinType;
import com.hlsflow.compiler.ast.type.NamedType;
import com.hlsflow.compiler.ast.type.TemplateArgument;
import com.hlsflow.compiler.ast.type.TypeRef;
import com.hlsflow.translator.TranslationException;
import com.hlsflow.translator.scan.DeclarationIndex;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 把 AST 类型引用解析为 {@link CType}，并按实参列表实例化、缓存结构体布局。
 */
public final class TypeResolver {

    private static final Logger LOG = Logger.getLogger(TypeResolver.class.getName());

    private final DeclarationIndex index;
    private final ConstantEvaluator constants;
    /** 实例键（全限定名 + 实参）→ 布局 */
    private final Map<String, StructLayout> instances = new HashMap<>();

    public TypeResolver(DeclarationIndex index) {
        this.index = index;
        this.constants = new ConstantEvaluator(index, this);
    }

    public ConstantEvaluator getConstants() {
        return constants;
    }

    public DeclarationIndex getIndex() {
        return index;
    }

    public static boolean isAuto(TypeRef ref) {
        return ref instanceof BuiltinType && ((BuiltinType) ref).getKind() == BuiltinType.Kind.AUTO;
    }

    public CType resolve(TypeRef ref, TypeScope scope) {
        if (ref instanceof BuiltinType) {
            return resolveBuiltin((BuiltinType) ref);
        }
        if (ref instanceof NamedType) {
            return resolveNamed((NamedType) ref, scope);
        }
        throw TranslationException.unsupported("Unsupported type '" + ref.getSpelling() + "'", ref.getLocation());
    }

    /** 解析带数组维度的声明类型，如 int a[2][3] */
    public CType resolve(TypeRef ref, List<Expression> dimensions, TypeScope scope) {
        CType type = resolve(ref, scope);
        for (int i = dimensions.size() - 1; i >= 0; i--) {
            Expression dim = dimensions.get(i);
            if (dim == null) {
                throw TranslationException.unsupported("Array of unknown size", ref.getLocation());
            }
            long length = constants.evaluate(dim, scope).getValue();
            if (length <= 0 || length > Integer.MAX_VALUE) {
                throw TranslationException.unsupported("Invalid array length " + length, dim.getLocation());
            }
            type = CType.arrayOf(type, (int) length);
        }
        return type;
    }

    private CType resolveBuiltin(BuiltinType t) {
        boolean signed = !t.isUnsigned();
        switch (t.getKind()) {
            case VOID:
                return CType.VOID;
            case BOOL:
                return CType.BOOL;
            case CHAR:
                return CType.intType(8, signed);
            case SHORT:
                return CType.intType(16, signed);
            case INT:
                return CType.intType(32, signed);
            case LONG:
            case LONG_LONG:
                return CType.intType(64, signed);
            case AUTO:
                throw TranslationException.unsupported("'auto' requires an initializer", t.getLocation());
            default:
                throw TranslationException.unsupported("Unsupported type '" + t.getSpelling() + "'", t.getLocation());
        }
    }

    private CType resolveNamed(NamedType t, TypeScope scope) {
        QualifiedName name = t.getName();
        String spelled = name.toString();
        SourceLocation loc = t.getLocation();
        if (!name.isQualified() && !t.hasTemplateArguments()) {
            CType bound = scope.lookupType(spelled);
            if (bound != null) {
                return bound;
            }
        }
        if (BuiltinNames.CHANNEL.equals(spelled)) {
            List<TemplateArgument> args = t.getTemplateArguments();
            if (args.size() != 1 || !args.get(0).isType()) {
                throw TranslationException.unsupported(BuiltinNames.CHANNEL + " takes one type argument", loc);
            }
            return CType.channel(resolve(args.get(0).getType(), scope));
        }
        int[] fixed = BuiltinNames.FIXED_WIDTH_ALIASES.get(spelled);
        if (fixed != null) {
            return CType.intType(fixed[0], fixed[1] == 0);
        }
        StructLayout enclosing = scope.getEnclosingStruct();
        if (enclosing != null && !name.isQualified() && !t.hasTemplateArguments()
                && spelled.equals(enclosing.getDecl().getName())) {
            return CType.struct(enclosing);
        }
        TypedefDecl typedef = index.findTypedef(name, scope.getNamespace());
        if (typedef != null) {
            return resolve(typedef.getAliasedType(), TypeScope.inNamespace(index.namespaceOf(typedef)));
        }
        StructDecl struct = index.findStruct(name, scope.getNamespace());
        if (struct != null) {
            return CType.struct(instantiate(struct, t.getTemplateArguments(), scope, loc));
        }
        throw TranslationException.parse("unknown type name '" + spelled + "'", loc);
    }

    /**
     * 按名字解析非模板类型，找不到返回 null（用于区分 Type::member 与命名空间限定）
     */
    public CType tryResolveName(QualifiedName name, TypeScope scope) {
        String spelled = name.toString();
        if (!name.isQualified()) {
            CType bound = scope.lookupType(spelled);
            if (bound != null) {
                return bound;
            }
            StructLayout enclosing = scope.getEnclosingStruct();
            if (enclosing != null && spelled.equals(enclosing.getDecl().getName())) {
                return CType.struct(enclosing);
            }
        }
        TypedefDecl typedef = index.findTypedef(name, scope.getNamespace());
        if (typedef != null) {
            return resolve(typedef.getAliasedType(), TypeScope.inNamespace(index.namespaceOf(typedef)));
        }
        StructDecl struct = index.findStruct(name, scope.getNamespace());
        if (struct != null && !struct.isTemplate()) {
            return CType.struct(instantiate(struct, new ArrayList<TemplateArgument>(), scope, struct.getLocation()));
        }
        return null;
    }

    /**
     * 结构体实例的布局；同一实参列表只布局一次
     */
    public StructLayout instantiate(StructDecl decl, List<TemplateArgument> args, TypeScope argScope,
                                    SourceLocation loc) {
        List<TemplateParameter> params = decl.getTemplateParameters();
        if (params.size() != args.size()) {
            throw TranslationException.unsupported("Wrong number of template arguments for '" + decl.getName()
                    + "': expected " + params.size() + ", got " + args.size(), loc);
        }
        String namespace = index.namespaceOf(decl);
        TypeScope scope = TypeScope.inNamespace(namespace).child();
        List<String> spelled = new ArrayList<>();
        for (int i = 0; i < params.size(); i++) {
            TemplateParameter p = params.get(i);
            TemplateArgument a = args.get(i);
            if (p.isTypeParameter()) {
                if (!a.isType()) {
                    throw TranslationException.unsupported("Template parameter '" + p.getName()
                            + "' expects a type", loc);
                }
                CType bound = resolve(a.getType(), argScope);
                scope.bindType(p.getName(), bound);
                spelled.add(bound.toString());
            } else {
                if (a.isType()) {
                    throw TranslationException.unsupported("Template parameter '" + p.getName()
                            + "' expects a constant", loc);
                }
                CType valueType = resolve(p.getValueType(), scope);
                ConstantValue bound = constants.evaluateAs(a.getValue(), valueType, argScope);
                scope.bindConstant(p.getName(), bound);
                spelled.add(bound.toString());
            }
        }
        String display = params.isEmpty() ? decl.getName() : decl.getName() + "<" + String.join(", ", spelled) + ">";
        String key = namespace + display;
        StructLayout cached = instances.get(key);
        if (cached != null) {
            return cached;
        }

        StructLayout layout = new StructLayout(display, decl, decl.hasPragma(Pragma.NO_TUPLE));
        instances.put(key, layout);
        layout.setScope(scope.withStruct(layout));

        List<BaseSpecifier> bases = decl.getBases();
        if (bases.size() > 1 || (bases.size() == 1 && bases.get(0).isVirtual())) {
            throw TranslationException.unsupported("multiple inheritance is not supported", decl.getLocation());
        }
        if (bases.size() == 1) {
            CType base = resolve(bases.get(0).getType(), layout.getScope());
            if (!base.isStruct()) {
                throw TranslationException.unsupported("Base of '" + decl.getName() + "' is not a struct",
                        decl.getLocation());
            }
            layout.setBase(base.getStruct());
        }
        for (FieldDecl field : decl.getFields()) {
            if (field.isStatic()) {
                bindStaticConstant(layout, field);
                continue;
            }
            CType type = resolve(field.getType(), field.getArrayDimensions(), layout.getScope());
            if (type.isVoid()) {
                throw TranslationException.unsupported("Field '" + field.getName() + "' has void type",
                        field.getLocation());
            }
            layout.addField(field.getName(), type, field);
        }
        layout.complete();
        LOG.fine("Laid out struct " + display + " with " + layout.getFieldCount() + " fields");
        return layout;
    }

    private void bindStaticConstant(StructLayout layout, FieldDecl field) {
        if (!field.getType().isConst() || field.getInitializer() == null) {
            throw TranslationException.unsupported("Static data member '" + field.getName()
                    + "' must be a constant", field.getLocation());
        }
        CType type = resolve(field.getType(), layout.getScope());
        layout.getScope().bindConstant(field.getName(),
                constants.evaluateAs(field.getInitializer(), type, layout.getScope()));
    }
}
