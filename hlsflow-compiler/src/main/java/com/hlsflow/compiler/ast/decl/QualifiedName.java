package com.hlsflow.compiler.ast.decl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 限定名（如 test::do_something）
 */
public final class QualifiedName {
    private final List<String> parts;

    public QualifiedName(List<String> parts) {
        this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
    }

    public static QualifiedName of(String simpleName) {
        return new QualifiedName(Collections.singletonList(simpleName));
    }

    public List<String> getParts() {
        return parts;
    }

    public String getSimpleName() {
        return parts.get(parts.size() - 1);
    }

    public boolean isQualified() {
        return parts.size() > 1;
    }

    /** 去掉最后一段后的前缀（"a::b::c" → "a::b"），非限定名返回空串 */
    public String getQualifier() {
        return String.join("::", parts.subList(0, parts.size() - 1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QualifiedName)) return false;
        return parts.equals(((QualifiedName) o).parts);
    }

    @Override
    public int hashCode() {
        return parts.hashCode();
    }

    @Override
    public String toString() {
        return String.join("::", parts);
    }
}
