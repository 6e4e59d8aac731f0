package com.hlsflow.translator.io;

import com.hlsflow.ir.node.IrNode;

/**
 * 通道操作在 IR 中的落地方式（函数参数 / 输出，或 proc 端口操作）
 */
public interface IoBackend {

    /** 生成接收值节点 */
    IrNode receive(IoOp op);

    /** 生成（或登记）发送 */
    void send(IoOp op);

    /** 翻译结束后的收尾 */
    default void finish(IoScheduler scheduler) {
    }
}
