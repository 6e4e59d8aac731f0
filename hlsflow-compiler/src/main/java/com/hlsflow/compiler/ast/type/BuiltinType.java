package com.hlsflow.compiler.ast.type;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;

/**
 * 内置类型（void, bool, char, short, int, long, long long 及其 unsigned 形式）
 */
public final class BuiltinType extends TypeRef {

    public enum Kind {
        VOID("void"),
        BOOL("bool"),
        CHAR("char"),
        SHORT("short"),
        INT("int"),
        LONG("long"),
        LONG_LONG("long long"),
        AUTO("auto");

        private final String spelling;

        Kind(String spelling) {
            this.spelling = spelling;
        }

        public String getSpelling() {
            return spelling;
        }
    }

    private final Kind kind;
    private final boolean unsigned;

    public BuiltinType(SourceLocation location, Kind kind, boolean unsigned,
                       boolean constQualified, boolean reference) {
        super(location, constQualified, reference);
        this.kind = kind;
        this.unsigned = unsigned;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isUnsigned() {
        return unsigned;
    }

    @Override
    public TypeRef withQualifiers(boolean constQualified, boolean reference) {
        return new BuiltinType(location, kind, unsigned, constQualified, reference);
    }

    @Override
    public String getSpelling() {
        return (unsigned ? "unsigned " : "") + kind.getSpelling();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBuiltinType(this, context);
    }
}
