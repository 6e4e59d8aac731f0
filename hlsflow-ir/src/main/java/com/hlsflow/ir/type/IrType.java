package com.hlsflow.ir.type;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * IR 类型：位向量、元组、定长数组。
 */
public final class IrType {

    public enum Kind {
        BITS, TUPLE, ARRAY
    }

    public static final int MAX_BITS_WIDTH = 64;

    private static final IrType EMPTY_TUPLE = new IrType(Kind.TUPLE, 0, Collections.<IrType>emptyList(), null, 0);

    private final Kind kind;
    private final int width;                 // BITS 时使用
    private final List<IrType> elementTypes; // TUPLE 时使用
    private final IrType elementType;        // ARRAY 时使用
    private final int size;                  // ARRAY 时使用

    private IrType(Kind kind, int width, List<IrType> elementTypes, IrType elementType, int size) {
        this.kind = kind;
        this.width = width;
        this.elementTypes = elementTypes;
        this.elementType = elementType;
        this.size = size;
    }

    public static IrType bits(int width) {
        if (width < 0 || width > MAX_BITS_WIDTH) {
            throw new IllegalArgumentException("Unsupported bits width: " + width);
        }
        return new IrType(Kind.BITS, width, Collections.<IrType>emptyList(), null, 0);
    }

    public static IrType bool() {
        return bits(1);
    }

    public static IrType tuple(List<IrType> elementTypes) {
        if (elementTypes.isEmpty()) {
            return EMPTY_TUPLE;
        }
        return new IrType(Kind.TUPLE, 0, Collections.unmodifiableList(new ArrayList<>(elementTypes)), null, 0);
    }

    public static IrType tuple(IrType... elementTypes) {
        return tuple(Arrays.asList(elementTypes));
    }

    public static IrType emptyTuple() {
        return EMPTY_TUPLE;
    }

    public static IrType array(IrType elementType, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Array size must be positive: " + size);
        }
        return new IrType(Kind.ARRAY, 0, Collections.<IrType>emptyList(), elementType, size);
    }

    public Kind getKind() { return kind; }
    public boolean isBits() { return kind == Kind.BITS; }
    public boolean isTuple() { return kind == Kind.TUPLE; }
    public boolean isArray() { return kind == Kind.ARRAY; }

    public int getWidth() {
        requireKind(Kind.BITS);
        return width;
    }

    public List<IrType> getElementTypes() {
        requireKind(Kind.TUPLE);
        return elementTypes;
    }

    public IrType getElementType(int index) {
        requireKind(Kind.TUPLE);
        return elementTypes.get(index);
    }

    public IrType getElementType() {
        requireKind(Kind.ARRAY);
        return elementType;
    }

    public int getSize() {
        requireKind(Kind.ARRAY);
        return size;
    }

    /** 展平后的总位数 */
    public int getFlatBitCount() {
        switch (kind) {
            case BITS: return width;
            case ARRAY: return elementType.getFlatBitCount() * size;
            default: {
                int total = 0;
                for (IrType t : elementTypes) {
                    total += t.getFlatBitCount();
                }
                return total;
            }
        }
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expected " + expected + " type, got " + this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrType)) return false;
        IrType other = (IrType) o;
        return kind == other.kind && width == other.width && size == other.size
                && elementTypes.equals(other.elementTypes)
                && Objects.equals(elementType, other.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, width, elementTypes, elementType, size);
    }

    @Override
    public String toString() {
        switch (kind) {
            case BITS: return "bits[" + width + "]";
            case ARRAY: return elementType + "[" + size + "]";
            default: {
                StringBuilder sb = new StringBuilder("(");
                for (int i = 0; i < elementTypes.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(elementTypes.get(i));
                }
                return sb.append(')').toString();
            }
        }
    }
}
