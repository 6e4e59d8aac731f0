package com.hlsflow.ir.value;

import com.hlsflow.ir.type.IrType;

/**
 * 定宽位向量（宽度 0..64），以补码 long 存储，高位始终清零。
 */
public final class Bits {

    private final int width;
    private final long value;

    private Bits(int width, long value) {
        this.width = width;
        this.value = value & mask(width);
    }

    public static Bits of(int width, long value) {
        if (width < 0 || width > IrType.MAX_BITS_WIDTH) {
            throw new IllegalArgumentException("Unsupported bits width: " + width);
        }
        return new Bits(width, value);
    }

    public static Bits ofBool(boolean value) {
        return new Bits(1, value ? 1 : 0);
    }

    public static Bits zero(int width) {
        return of(width, 0);
    }

    public static Bits allOnes(int width) {
        return of(width, -1L);
    }

    /** 宽度对应的低位掩码 */
    public static long mask(int width) {
        return width >= 64 ? -1L : (1L << width) - 1;
    }

    public int getWidth() {
        return width;
    }

    /** 无符号值（按位） */
    public long toUnsignedLong() {
        return value;
    }

    /** 按最高位符号扩展后的值 */
    public long toSignedLong() {
        if (width == 0) {
            return 0;
        }
        if (width == 64) {
            return value;
        }
        int shift = 64 - width;
        return (value << shift) >> shift;
    }

    public boolean isZero() {
        return value == 0;
    }

    public boolean isAllOnes() {
        return value == mask(width);
    }

    public boolean isTrue() {
        return !isZero();
    }

    public boolean getBit(int index) {
        return ((value >>> index) & 1L) != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bits)) return false;
        Bits other = (Bits) o;
        return width == other.width && value == other.value;
    }

    @Override
    public int hashCode() {
        return 31 * width + Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "bits[" + width + "]:" + Long.toUnsignedString(value);
    }
}
