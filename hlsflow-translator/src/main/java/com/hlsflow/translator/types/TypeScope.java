package com.hlsflow.translator.types;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 类型查找作用域：命名空间前缀、模板形参绑定与所在结构体。
 */
public final class TypeScope {

    private final TypeScope parent;
    private final String namespace;
    private final StructLayout enclosingStruct;
    private final Map<String, CType> types = new LinkedHashMap<>();
    private final Map<String, ConstantValue> constants = new LinkedHashMap<>();

    private TypeScope(TypeScope parent, String namespace, StructLayout enclosingStruct) {
        this.parent = parent;
        this.namespace = namespace;
        this.enclosingStruct = enclosingStruct;
    }

    public static TypeScope global() {
        return new TypeScope(null, "", null);
    }

    /** 进入命名空间（namespace 形如 "a::b::"） */
    public static TypeScope inNamespace(String namespace) {
        return new TypeScope(null, namespace, null);
    }

    public TypeScope child() {
        return new TypeScope(this, namespace, enclosingStruct);
    }

    public TypeScope withStruct(StructLayout layout) {
        return new TypeScope(this, namespace, layout);
    }

    public TypeScope bindType(String name, CType type) {
        types.put(name, type);
        return this;
    }

    public TypeScope bindConstant(String name, ConstantValue value) {
        constants.put(name, value);
        return this;
    }

    public CType lookupType(String name) {
        for (TypeScope s = this; s != null; s = s.parent) {
            CType t = s.types.get(name);
            if (t != null) {
                return t;
            }
        }
        return null;
    }

    public ConstantValue lookupConstant(String name) {
        for (TypeScope s = this; s != null; s = s.parent) {
            ConstantValue v = s.constants.get(name);
            if (v != null) {
                return v;
            }
        }
        return null;
    }

    public String getNamespace() {
        return namespace;
    }

    public StructLayout getEnclosingStruct() {
        return enclosingStruct;
    }

    /** 本作用域链上全部绑定的稳定文本，用作实例缓存键 */
    public String bindingSignature() {
        StringBuilder sb = new StringBuilder();
        for (TypeScope s = this; s != null; s = s.parent) {
            for (Map.Entry<String, CType> e : s.types.entrySet()) {
                sb.append(e.getKey()).append('=').append(e.getValue()).append(';');
            }
            for (Map.Entry<String, ConstantValue> e : s.constants.entrySet()) {
                sb.append(e.getKey()).append('=').append(e.getValue()).append(';');
            }
        }
        return sb.toString();
    }
}
