package com.hlsflow.translator.io;

import com.hlsflow.ir.IrBuilder;
import com.hlsflow.ir.IrChannel;
import com.hlsflow.ir.node.IrNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * proc 单值模式：同一物理通道上的操作合并为一个端口操作。
 *
 * <p>接收共用一次读取；发送推迟到翻译结束，经优先选择网络合并：
 * 最后一个激活的写入胜出，谓词为各条件的或。</p>
 */
public final class SingleValueIoBackend implements IoBackend {

    private static final Logger LOG = Logger.getLogger(SingleValueIoBackend.class.getName());

    private final IrBuilder builder;
    private final Map<String, IrChannel> channels;
    private final Map<String, IrNode> reads = new HashMap<>();

    public SingleValueIoBackend(IrBuilder builder, Map<String, IrChannel> channels) {
        this.builder = builder;
        this.channels = channels;
    }

    @Override
    public IrNode receive(IoOp op) {
        StreamingIoBackend.requireDirection(channels, op, IrChannel.Direction.IN);
        IrNode read = reads.get(op.getChannel());
        if (read == null) {
            read = builder.receive(op.getChannel(), op.getPayloadType().toIrType(), null);
            reads.put(op.getChannel(), read);
        }
        return read;
    }

    @Override
    public void send(IoOp op) {
        StreamingIoBackend.requireDirection(channels, op, IrChannel.Direction.OUT);
    }

    @Override
    public void finish(IoScheduler scheduler) {
        for (Map.Entry<String, List<IoOp>> entry : scheduler.opsByChannel(IoOp.Kind.SEND).entrySet()) {
            List<IoOp> sends = entry.getValue();
            if (sends.size() == 1) {
                IoOp op = sends.get(0);
                builder.send(entry.getKey(), op.getPayload(), StreamingIoBackend.predicate(op.getCondition()));
                continue;
            }
            // 程序顺序中最后的写入占最低位，优先级最高
            List<IrNode> conditions = new ArrayList<>();
            List<IrNode> cases = new ArrayList<>();
            IrNode any = builder.literalBool(false);
            for (IoOp op : sends) {
                conditions.add(op.getCondition());
                cases.add(0, op.getPayload());
                any = builder.or(any, op.getCondition());
            }
            IrNode selector = builder.concat(conditions);
            IrNode data = builder.prioritySelect(selector, cases, sends.get(sends.size() - 1).getPayload());
            builder.send(entry.getKey(), data, StreamingIoBackend.predicate(any));
            LOG.fine("Merged " + sends.size() + " sends on channel " + entry.getKey());
        }
    }
}
