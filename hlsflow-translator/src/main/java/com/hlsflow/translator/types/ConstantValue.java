package com.hlsflow.translator.types;

/**
 * 编译期整数常量（非类型模板实参、const 全局量）
 */
public final class ConstantValue {
    private final long value;
    private final CType type;

    public ConstantValue(long value, CType type) {
        this.value = value;
        this.type = type;
    }

    public long getValue() {
        return value;
    }

    public CType getType() {
        return type;
    }

    @Override
    public String toString() {
        return type.isBool() ? String.valueOf(value != 0) : String.valueOf(value);
    }
}
