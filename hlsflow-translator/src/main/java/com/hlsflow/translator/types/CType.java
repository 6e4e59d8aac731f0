package com.hlsflow.translator.types;

import com.hlsflow.ir.type.IrType;

import java.util.Objects;

/**
 * 源语言类型描述符。
 *
 * <p>整数携带位宽与符号；数组携带静态长度；结构体引用其布局；
 * 通道只在参数位置出现，IR 中表示为空元组。</p>
 */
public final class CType {

    public enum Kind {
        VOID, INT, BOOL, ARRAY, STRUCT, CHANNEL
    }

    public static final CType VOID = new CType(Kind.VOID, 0, false, null, 0, null);
    public static final CType BOOL = new CType(Kind.BOOL, 1, false, null, 0, null);
    public static final CType CHAR = intType(8, true);
    public static final CType UCHAR = intType(8, false);
    public static final CType SHORT = intType(16, true);
    public static final CType USHORT = intType(16, false);
    public static final CType INT = intType(32, true);
    public static final CType UINT = intType(32, false);
    public static final CType LONG = intType(64, true);
    public static final CType ULONG = intType(64, false);

    private final Kind kind;
    private final int width;
    private final boolean signed;
    private final CType element;
    private final int length;
    private final StructLayout struct;

    private CType(Kind kind, int width, boolean signed, CType element, int length, StructLayout struct) {
        this.kind = kind;
        this.width = width;
        this.signed = signed;
        this.element = element;
        this.length = length;
        this.struct = struct;
    }

    public static CType intType(int width, boolean signed) {
        if (width <= 0 || width > IrType.MAX_BITS_WIDTH) {
            throw new IllegalArgumentException("Unsupported integer width: " + width);
        }
        return new CType(Kind.INT, width, signed, null, 0, null);
    }

    public static CType arrayOf(CType element, int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Array length must be positive: " + length);
        }
        return new CType(Kind.ARRAY, 0, false, element, length, null);
    }

    public static CType struct(StructLayout layout) {
        return new CType(Kind.STRUCT, 0, false, null, 0, layout);
    }

    public static CType channel(CType element) {
        return new CType(Kind.CHANNEL, 0, false, element, 0, null);
    }

    public Kind getKind() { return kind; }
    public boolean isVoid() { return kind == Kind.VOID; }
    public boolean isInt() { return kind == Kind.INT; }
    public boolean isBool() { return kind == Kind.BOOL; }
    public boolean isArray() { return kind == Kind.ARRAY; }
    public boolean isStruct() { return kind == Kind.STRUCT; }
    public boolean isChannel() { return kind == Kind.CHANNEL; }

    /** 整数或布尔 */
    public boolean isIntegral() {
        return kind == Kind.INT || kind == Kind.BOOL;
    }

    public int getWidth() {
        return width;
    }

    public boolean isSigned() {
        return signed;
    }

    /** 数组元素或通道负载类型 */
    public CType getElement() {
        return element;
    }

    public int getLength() {
        return length;
    }

    public StructLayout getStruct() {
        return struct;
    }

    /**
     * 对应的 IR 类型
     */
    public IrType toIrType() {
        switch (kind) {
            case INT:
            case BOOL:
                return IrType.bits(width);
            case ARRAY:
                return IrType.array(element.toIrType(), length);
            case STRUCT:
                return struct.toIrType();
            case CHANNEL:
            case VOID:
                return IrType.emptyTuple();
            default:
                throw new IllegalStateException("Unknown kind " + kind);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CType)) return false;
        CType other = (CType) o;
        return kind == other.kind && width == other.width && signed == other.signed
                && length == other.length && Objects.equals(element, other.element)
                && struct == other.struct;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, width, signed, element, length,
                struct == null ? 0 : System.identityHashCode(struct));
    }

    @Override
    public String toString() {
        switch (kind) {
            case VOID: return "void";
            case BOOL: return "bool";
            case INT: return intSpelling();
            case ARRAY: return element + "[" + length + "]";
            case STRUCT: return struct.getName();
            case CHANNEL: return "__hls_channel<" + element + ">";
            default: return kind.name();
        }
    }

    private String intSpelling() {
        String base;
        switch (width) {
            case 8: base = "char"; break;
            case 16: base = "short"; break;
            case 32: base = "int"; break;
            case 64: base = "long long"; break;
            default: return (signed ? "int" : "uint") + width + "_t";
        }
        return signed ? base : "unsigned " + base;
    }
}
