package com.hlsflow.translator.io;

import com.hlsflow.ir.IrBuilder;
import com.hlsflow.ir.node.IrNode;

/**
 * 函数模式：接收值先用占位参数表示，翻译结束后由生成器换成按通道分组的真实参数；
 * 发送不产生节点，其数据与条件直接成为输出。
 */
public final class FunctionIoBackend implements IoBackend {

    static final String PLACEHOLDER_PREFIX = "__recv";

    private final IrBuilder builder;

    public FunctionIoBackend(IrBuilder builder) {
        this.builder = builder;
    }

    @Override
    public IrNode receive(IoOp op) {
        return builder.param(PLACEHOLDER_PREFIX + op.getOrder(), op.getPayloadType().toIrType());
    }

    @Override
    public void send(IoOp op) {
    }
}
