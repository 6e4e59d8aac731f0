package com.hlsflow.ir.interp;

import com.hlsflow.ir.IrChannel;
import com.hlsflow.ir.value.IrValue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 通道队列。STREAMING 为 FIFO；SINGLE_VALUE 保留最后写入的值，读取不消耗。
 */
public class ChannelQueue {

    private final IrChannel channel;
    private final Deque<IrValue> values = new ArrayDeque<>();

    public ChannelQueue(IrChannel channel) {
        this.channel = channel;
    }

    public IrChannel getChannel() {
        return channel;
    }

    public String getName() {
        return channel.getName();
    }

    public void write(IrValue value) {
        if (!value.getType().equals(channel.getType())) {
            throw new IrEvaluationException("Channel '" + channel.getName() + "' has type "
                    + channel.getType() + ", cannot write " + value.getType());
        }
        if (channel.getKind() == IrChannel.Kind.SINGLE_VALUE) {
            values.clear();
        }
        values.addLast(value);
    }

    /** 第 offset 个可读值（不消耗），不存在时返回 null */
    public IrValue peek(int offset) {
        if (channel.getKind() == IrChannel.Kind.SINGLE_VALUE) {
            return values.peekLast();
        }
        int i = 0;
        for (IrValue v : values) {
            if (i++ == offset) {
                return v;
            }
        }
        return null;
    }

    /** 读取并消耗（SINGLE_VALUE 不消耗） */
    public IrValue read() {
        if (values.isEmpty()) {
            throw new IrEvaluationException("Channel '" + channel.getName() + "' is empty");
        }
        if (channel.getKind() == IrChannel.Kind.SINGLE_VALUE) {
            return values.peekLast();
        }
        return values.pollFirst();
    }

    /** 消耗 count 个值（提交迭代时调用） */
    void consume(int count) {
        if (channel.getKind() == IrChannel.Kind.SINGLE_VALUE) {
            return;
        }
        for (int i = 0; i < count; i++) {
            values.pollFirst();
        }
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    /** 读出全部剩余值 */
    public List<IrValue> drain() {
        List<IrValue> drained = new ArrayList<>(values);
        if (channel.getKind() == IrChannel.Kind.STREAMING) {
            values.clear();
        }
        return drained;
    }

    @Override
    public String toString() {
        return channel.getName() + values;
    }
}
