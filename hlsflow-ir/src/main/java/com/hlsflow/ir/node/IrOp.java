package com.hlsflow.ir.node;

/**
 * IR 节点操作码。
 */
public enum IrOp {
    // 源
    PARAM, LITERAL, STATE_READ,
    // 算术
    ADD, SUB, MUL, UDIV, SDIV, UMOD, SMOD, NEG,
    // 位运算
    AND, OR, XOR, NOT,
    // 移位
    SHLL, SHRL, SHRA,
    // 比较（结果 bits[1]）
    EQ, NE, ULT, ULE, UGT, UGE, SLT, SLE, SGT, SGE,
    // 选择
    SEL, PRIORITY_SEL,
    // 宽度
    ZERO_EXT, SIGN_EXT, BIT_SLICE, CONCAT,
    // 聚合
    TUPLE, TUPLE_INDEX, ARRAY, ARRAY_INDEX, ARRAY_UPDATE,
    // 调用与通道
    INVOKE, RECEIVE, SEND;

    public boolean isComparison() {
        return ordinal() >= EQ.ordinal() && ordinal() <= SGE.ordinal();
    }

    public boolean isBinaryBitwise() {
        return this == AND || this == OR || this == XOR;
    }

    /** 是否有副作用或依赖外部状态（不可折叠、不可删除） */
    public boolean isSideEffecting() {
        return this == RECEIVE || this == SEND;
    }

    /** 值仅由操作数决定，可在构建期折叠 */
    public boolean isFoldable() {
        switch (this) {
            case PARAM: case LITERAL: case STATE_READ: case RECEIVE: case SEND: case INVOKE:
                return false;
            default:
                return true;
        }
    }

    /** 文本形式的小写名 */
    public String getMnemonic() {
        return name().toLowerCase();
    }
}
