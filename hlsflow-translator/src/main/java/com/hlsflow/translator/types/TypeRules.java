package com.hlsflow.translator.types;

import com.hlsflow.compiler.ast.expr.IntLiteral;

/**
 * 整数提升与常用算术转换
 */
public final class TypeRules {

    private TypeRules() {
    }

    /** 比 int 窄的整数与 bool 提升为 int */
    public static CType promote(CType t) {
        if (t.isBool() || (t.isInt() && t.getWidth() < 32)) {
            return CType.INT;
        }
        return t;
    }

    /** 二元运算的公共类型：宽者优先，等宽时无符号优先 */
    public static CType common(CType a, CType b) {
        CType pa = promote(a);
        CType pb = promote(b);
        if (pa.equals(pb)) {
            return pa;
        }
        if (pa.getWidth() != pb.getWidth()) {
            return pa.getWidth() > pb.getWidth() ? pa : pb;
        }
        return pa.isSigned() ? pb : pa;
    }

    /**
     * 字面量的类型：十进制不选无符号，十六进制等可以落到无符号。
     */
    public static CType literalType(IntLiteral literal) {
        if (literal.isCharacter()) {
            return CType.CHAR;
        }
        long v = literal.getValue();
        boolean fitsInt = v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE;
        boolean fitsUInt = v >= 0 && v <= 0xFFFFFFFFL;
        if (literal.getLongCount() == 0) {
            if (literal.isUnsigned()) {
                return fitsUInt ? CType.UINT : CType.ULONG;
            }
            if (fitsInt) {
                return CType.INT;
            }
            if (!literal.isDecimal() && fitsUInt) {
                return CType.UINT;
            }
            return v >= 0 ? CType.LONG : CType.ULONG;
        }
        if (literal.isUnsigned()) {
            return CType.ULONG;
        }
        return v >= 0 ? CType.LONG : CType.ULONG;
    }

    /** 把 long 值截断 / 扩展为类型 t 的规范表示 */
    public static long normalize(long value, CType t) {
        if (t.isBool()) {
            return value != 0 ? 1 : 0;
        }
        int width = t.getWidth();
        if (width >= 64) {
            return value;
        }
        long mask = (1L << width) - 1;
        long masked = value & mask;
        if (t.isSigned() && (masked >>> (width - 1)) != 0) {
            return masked | ~mask;
        }
        return masked;
    }
}
