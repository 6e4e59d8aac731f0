package com.hlsflow.translator.io;

import com.hlsflow.ir.node.IrNode;
import com.hlsflow.translator.types.CType;

/**
 * 一次通道操作的记录：种类、通道、激活条件与程序顺序。
 */
public final class IoOp {

    public enum Kind {
        RECEIVE, SEND
    }

    private final Kind kind;
    private final String channel;
    private final CType payloadType;
    private final int order;
    private IrNode condition;
    /** 发送的数据 */
    private IrNode payload;
    /** 接收得到的值（函数模式下先是占位参数） */
    private IrNode value;

    IoOp(Kind kind, String channel, CType payloadType, int order, IrNode condition) {
        this.kind = kind;
        this.channel = channel;
        this.payloadType = payloadType;
        this.order = order;
        this.condition = condition;
    }

    public Kind getKind() { return kind; }
    public String getChannel() { return channel; }
    public CType getPayloadType() { return payloadType; }
    /** 程序顺序下标 */
    public int getOrder() { return order; }

    /** 激活条件，也是 fired 标志 */
    public IrNode getCondition() { return condition; }

    public IrNode getPayload() { return payload; }

    public IrNode getValue() { return value; }

    public boolean isReceive() {
        return kind == Kind.RECEIVE;
    }

    void setPayload(IrNode payload) {
        this.payload = payload;
    }

    public void setValue(IrNode value) {
        this.value = value;
    }

    public void setCondition(IrNode condition) {
        this.condition = condition;
    }

    @Override
    public String toString() {
        return (kind == Kind.RECEIVE ? "recv " : "send ") + channel + "#" + order;
    }
}
