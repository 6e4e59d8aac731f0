package com.hlsflow.translator.scan;

import com.hlsflow.compiler.ast.decl.Declaration;
import com.hlsflow.compiler.ast.decl.FunctionDecl;
import com.hlsflow.compiler.ast.decl.GlobalVarDecl;
import com.hlsflow.compiler.ast.decl.NamespaceDecl;
import com.hlsflow.compiler.ast.decl.QualifiedName;
import com.hlsflow.compiler.ast.decl.StructDecl;
import com.hlsflow.compiler.ast.decl.TranslationUnit;
import com.hlsflow.compiler.ast.decl.TypedefDecl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 顶层声明索引：按全限定名（a::b::name）登记函数、结构体、typedef 与全局变量。
 *
 * <p>查找从当前命名空间开始，逐级向外直到全局。</p>
 */
public final class DeclarationIndex {

    private static final Logger LOG = Logger.getLogger(DeclarationIndex.class.getName());

    private final Map<String, List<FunctionDecl>> functions = new LinkedHashMap<>();
    private final Map<String, StructDecl> structs = new LinkedHashMap<>();
    private final Map<String, TypedefDecl> typedefs = new LinkedHashMap<>();
    private final Map<String, GlobalVarDecl> globals = new LinkedHashMap<>();
    private final Map<Declaration, String> namespaces = new IdentityHashMap<>();

    public static DeclarationIndex build(TranslationUnit unit) {
        DeclarationIndex index = new DeclarationIndex();
        index.addAll(unit.getDeclarations(), "");
        return index;
    }

    private void addAll(List<Declaration> declarations, String prefix) {
        for (Declaration decl : declarations) {
            namespaces.put(decl, prefix);
            String key = prefix + decl.getName();
            if (decl instanceof NamespaceDecl) {
                addAll(((NamespaceDecl) decl).getDeclarations(), key + "::");
            } else if (decl instanceof FunctionDecl) {
                functions.computeIfAbsent(key, k -> new ArrayList<>()).add((FunctionDecl) decl);
            } else if (decl instanceof StructDecl) {
                structs.put(key, (StructDecl) decl);
            } else if (decl instanceof TypedefDecl) {
                typedefs.put(key, (TypedefDecl) decl);
            } else if (decl instanceof GlobalVarDecl) {
                globals.put(key, (GlobalVarDecl) decl);
            }
        }
        LOG.fine("Indexed " + declarations.size() + " declarations in '" + prefix + "'");
    }

    /** 声明所在的命名空间前缀（全局为 ""） */
    public String namespaceOf(Declaration decl) {
        String ns = namespaces.get(decl);
        return ns != null ? ns : "";
    }

    /** 同名函数重载，找不到返回空列表 */
    public List<FunctionDecl> findFunctions(QualifiedName name, String fromNamespace) {
        List<FunctionDecl> found = lookup(functions, name, fromNamespace);
        return found != null ? found : Collections.<FunctionDecl>emptyList();
    }

    public StructDecl findStruct(QualifiedName name, String fromNamespace) {
        return lookup(structs, name, fromNamespace);
    }

    public TypedefDecl findTypedef(QualifiedName name, String fromNamespace) {
        return lookup(typedefs, name, fromNamespace);
    }

    public GlobalVarDecl findGlobal(QualifiedName name, String fromNamespace) {
        return lookup(globals, name, fromNamespace);
    }

    /** 全部顶层与命名空间内的函数（声明顺序） */
    public List<FunctionDecl> getAllFunctions() {
        List<FunctionDecl> all = new ArrayList<>();
        for (List<FunctionDecl> overloads : functions.values()) {
            all.addAll(overloads);
        }
        return all;
    }

    private static <T> T lookup(Map<String, T> map, QualifiedName name, String fromNamespace) {
        String suffix = name.toString();
        String prefix = fromNamespace;
        while (true) {
            T found = map.get(prefix + suffix);
            if (found != null) {
                return found;
            }
            if (prefix.isEmpty()) {
                return null;
            }
            prefix = outer(prefix);
        }
    }

    /** "a::b::" → "a::"，"a::" → "" */
    private static String outer(String prefix) {
        String trimmed = prefix.substring(0, prefix.length() - 2);
        int cut = trimmed.lastIndexOf("::");
        return cut < 0 ? "" : trimmed.substring(0, cut + 2);
    }
}
