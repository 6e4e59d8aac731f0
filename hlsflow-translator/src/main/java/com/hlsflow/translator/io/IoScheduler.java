package com.hlsflow.translator.io;

import com.hlsflow.ir.node.IrNode;
import com.hlsflow.translator.types.CType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 按程序顺序记录通道操作，并交给 {@link IoBackend} 生成节点。
 * 内联子程序与调用者共用同一个调度器，因此其操作落在调用位置。
 */
public final class IoScheduler {

    private static final Logger LOG = Logger.getLogger(IoScheduler.class.getName());

    private final IoBackend backend;
    private final List<IoOp> ops = new ArrayList<>();

    public IoScheduler(IoBackend backend) {
        this.backend = backend;
    }

    public IoOp recordReceive(String channel, CType type, IrNode condition) {
        IoOp op = new IoOp(IoOp.Kind.RECEIVE, channel, type, ops.size(), condition);
        ops.add(op);
        op.setValue(backend.receive(op));
        LOG.fine("Recorded " + op);
        return op;
    }

    public IoOp recordSend(String channel, IrNode payload, CType type, IrNode condition) {
        IoOp op = new IoOp(IoOp.Kind.SEND, channel, type, ops.size(), condition);
        op.setPayload(payload);
        ops.add(op);
        backend.send(op);
        LOG.fine("Recorded " + op);
        return op;
    }

    public List<IoOp> getOps() {
        return Collections.unmodifiableList(ops);
    }

    /** 按通道分组，组内保持程序顺序 */
    public Map<String, List<IoOp>> opsByChannel(IoOp.Kind kind) {
        Map<String, List<IoOp>> grouped = new LinkedHashMap<>();
        for (IoOp op : ops) {
            if (op.getKind() == kind) {
                grouped.computeIfAbsent(op.getChannel(), k -> new ArrayList<>()).add(op);
            }
        }
        return grouped;
    }

    public void finish() {
        backend.finish(this);
    }
}
