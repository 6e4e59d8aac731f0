package com.hlsflow.translator.types;

import com.hlsflow.compiler.ast.decl.FieldDecl;
import com.hlsflow.compiler.ast.decl.FunctionDecl;
import com.hlsflow.compiler.ast.decl.StructDecl;
import com.hlsflow.ir.type.IrType;
import com.hlsflow.translator.TranslationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 结构体（或模板实例）的字段布局。
 *
 * <p>展平后的字段顺序为基类字段在前、自身字段在后，决定 IR 元组布局。
 * 带 no-tuple 指令且只有一个字段时，值就是该字段本身。</p>
 */
public final class StructLayout {

    /**
     * 字段
     */
    public static final class Field {
        private final String name;
        private final CType type;
        private final FieldDecl decl;
        private final StructLayout owner;

        Field(String name, CType type, FieldDecl decl, StructLayout owner) {
            this.name = name;
            this.type = type;
            this.decl = decl;
            this.owner = owner;
        }

        public String getName() { return name; }
        public CType getType() { return type; }
        public FieldDecl getDecl() { return decl; }
        /** 声明该字段的布局（可能是基类） */
        public StructLayout getOwner() { return owner; }
    }

    /**
     * 方法及其声明所在的布局
     */
    public static final class Method {
        private final FunctionDecl decl;
        private final StructLayout owner;

        Method(FunctionDecl decl, StructLayout owner) {
            this.decl = decl;
            this.owner = owner;
        }

        public FunctionDecl getDecl() { return decl; }
        public StructLayout getOwner() { return owner; }
    }

    private final String name;
    private final StructDecl decl;
    private final boolean noTuple;
    private TypeScope scope;
    private StructLayout base;
    private final List<Field> ownFields = new ArrayList<>();
    private boolean complete;

    StructLayout(String name, StructDecl decl, boolean noTuple) {
        this.name = name;
        this.decl = decl;
        this.noTuple = noTuple;
    }

    void setScope(TypeScope scope) {
        this.scope = scope;
    }

    void setBase(StructLayout base) {
        this.base = base;
    }

    void addField(String fieldName, CType type, FieldDecl fieldDecl) {
        ownFields.add(new Field(fieldName, type, fieldDecl, this));
    }

    void complete() {
        if (noTuple && getAllFields().size() != 1) {
            throw TranslationException.layout("only 1 field supported with no-wrap directive",
                    decl.getLocation());
        }
        complete = true;
    }

    public boolean isComplete() {
        return complete;
    }

    /** 实例名，如 TestX&lt;int&gt; */
    public String getName() {
        return name;
    }

    public StructDecl getDecl() {
        return decl;
    }

    /** 成员（方法体、字段初始化器）使用的类型作用域 */
    public TypeScope getScope() {
        return scope;
    }

    public StructLayout getBase() {
        return base;
    }

    public boolean isNoTuple() {
        return noTuple;
    }

    public List<Field> getOwnFields() {
        return Collections.unmodifiableList(ownFields);
    }

    /** 展平后的全部字段 */
    public List<Field> getAllFields() {
        List<Field> all = new ArrayList<>();
        if (base != null) {
            all.addAll(base.getAllFields());
        }
        all.addAll(ownFields);
        return all;
    }

    public int getFieldCount() {
        return (base != null ? base.getFieldCount() : 0) + ownFields.size();
    }

    /** 字段在展平布局中的下标，-1 表示不存在；同名时派生类字段优先 */
    public int indexOfField(String fieldName) {
        List<Field> all = getAllFields();
        for (int i = all.size() - 1; i >= 0; i--) {
            if (all.get(i).getName().equals(fieldName)) {
                return i;
            }
        }
        return -1;
    }

    /** 是否是 other 本身或其（间接）基类 */
    public boolean isBaseOf(StructLayout other) {
        for (StructLayout l = other; l != null; l = l.base) {
            if (l == this) {
                return true;
            }
        }
        return false;
    }

    /** 按名字查找方法，自身没有时沿基类向上 */
    public List<Method> findMethods(String methodName) {
        List<Method> found = new ArrayList<>();
        for (FunctionDecl m : decl.getMethods()) {
            if (m.getKind() != FunctionDecl.Kind.CONSTRUCTOR && m.getName().equals(methodName)) {
                found.add(new Method(m, this));
            }
        }
        if (found.isEmpty() && base != null) {
            return base.findMethods(methodName);
        }
        return found;
    }

    public List<Method> getConstructors() {
        List<Method> found = new ArrayList<>();
        for (FunctionDecl m : decl.getMethods()) {
            if (m.getKind() == FunctionDecl.Kind.CONSTRUCTOR) {
                found.add(new Method(m, this));
            }
        }
        return found;
    }

    /** 转换运算符（operator T），含基类 */
    public List<Method> getConversions() {
        List<Method> found = new ArrayList<>();
        for (StructLayout l = this; l != null; l = l.base) {
            for (FunctionDecl m : l.decl.getMethods()) {
                if (m.getKind() == FunctionDecl.Kind.CONVERSION) {
                    found.add(new Method(m, l));
                }
            }
        }
        return found;
    }

    public IrType toIrType() {
        List<Field> all = getAllFields();
        if (noTuple) {
            return all.get(0).getType().toIrType();
        }
        List<IrType> types = new ArrayList<>(all.size());
        for (Field f : all) {
            types.add(f.getType().toIrType());
        }
        return IrType.tuple(types);
    }

    @Override
    public String toString() {
        return name;
    }
}
