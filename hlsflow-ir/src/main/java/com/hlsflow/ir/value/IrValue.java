package com.hlsflow.ir.value;

import com.hlsflow.ir.type.IrType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * IR 运行期值：位向量、元组或数组。不可变。
 */
public final class IrValue {

    private final IrType type;
    private final Bits bits;              // BITS 时使用
    private final List<IrValue> elements; // TUPLE / ARRAY 时使用

    private IrValue(IrType type, Bits bits, List<IrValue> elements) {
        this.type = type;
        this.bits = bits;
        this.elements = elements;
    }

    public static IrValue ofBits(Bits bits) {
        return new IrValue(IrType.bits(bits.getWidth()), bits, Collections.<IrValue>emptyList());
    }

    public static IrValue ofBits(int width, long value) {
        return ofBits(Bits.of(width, value));
    }

    public static IrValue ofBool(boolean value) {
        return ofBits(Bits.ofBool(value));
    }

    public static IrValue tuple(List<IrValue> elements) {
        List<IrType> types = new ArrayList<>(elements.size());
        for (IrValue e : elements) {
            types.add(e.getType());
        }
        return new IrValue(IrType.tuple(types), null, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public static IrValue tuple(IrValue... elements) {
        return tuple(Arrays.asList(elements));
    }

    public static IrValue array(List<IrValue> elements) {
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("Array value must have at least one element");
        }
        IrType elementType = elements.get(0).getType();
        for (IrValue e : elements) {
            if (!e.getType().equals(elementType)) {
                throw new IllegalArgumentException("Array elements must share one type: "
                        + elementType + " vs " + e.getType());
            }
        }
        return new IrValue(IrType.array(elementType, elements.size()), null,
                Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    /** 给定类型的全零值 */
    public static IrValue zero(IrType type) {
        switch (type.getKind()) {
            case BITS:
                return ofBits(Bits.zero(type.getWidth()));
            case ARRAY: {
                IrValue element = zero(type.getElementType());
                return array(Collections.nCopies(type.getSize(), element));
            }
            default: {
                List<IrValue> elements = new ArrayList<>();
                for (IrType t : type.getElementTypes()) {
                    elements.add(zero(t));
                }
                return tuple(elements);
            }
        }
    }

    public IrType getType() { return type; }
    public boolean isBits() { return type.isBits(); }
    public boolean isTuple() { return type.isTuple(); }
    public boolean isArray() { return type.isArray(); }

    public Bits getBits() {
        if (bits == null) {
            throw new IllegalStateException("Not a bits value: " + this);
        }
        return bits;
    }

    public List<IrValue> getElements() {
        if (bits != null) {
            throw new IllegalStateException("Not an aggregate value: " + this);
        }
        return elements;
    }

    public IrValue getElement(int index) {
        return getElements().get(index);
    }

    /** 位向量的无符号值 */
    public long toUnsignedLong() {
        return getBits().toUnsignedLong();
    }

    public long toSignedLong() {
        return getBits().toSignedLong();
    }

    public boolean isTrue() {
        return getBits().isTrue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrValue)) return false;
        IrValue other = (IrValue) o;
        if (!type.equals(other.type)) return false;
        return bits != null ? bits.equals(other.bits) : elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return bits != null ? bits.hashCode() : elements.hashCode();
    }

    @Override
    public String toString() {
        if (bits != null) {
            return bits.toString();
        }
        StringBuilder sb = new StringBuilder(type.isTuple() ? "(" : "[");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i));
        }
        return sb.append(type.isTuple() ? ")" : "]").toString();
    }
}
