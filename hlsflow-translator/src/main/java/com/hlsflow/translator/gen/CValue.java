package com.hlsflow.translator.gen;

import com.hlsflow.ir.node.IrNode;
import com.hlsflow.translator.types.CType;

/**
 * 翻译得到的值：IR 节点加源语言类型，不可变
 */
public final class CValue {
    private final IrNode node;
    private final CType type;

    public CValue(IrNode node, CType type) {
        this.node = node;
        this.type = type;
    }

    public IrNode getNode() {
        return node;
    }

    public CType getType() {
        return type;
    }

    @Override
    public String toString() {
        return node + " : " + type;
    }
}
