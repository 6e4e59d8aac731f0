package com.hlsflow.ir.interp;

import com.hlsflow.ir.IrProc;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.ir.value.IrValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Proc 解释器：一次 tick 执行一次迭代。
 *
 * <p>迭代是事务性的：读取先在队列上按偏移窥视，发送先缓冲；
 * 谓词为真的接收遇到空队列时整个迭代回滚，状态与队列都不变。</p>
 */
public class ProcInterpreter {

    private static final Logger LOG = Logger.getLogger(ProcInterpreter.class.getName());

    /**
     * 单次迭代的结果
     */
    public static final class RunResult {
        private final boolean iterationComplete;
        private final boolean progressMade;
        private final List<String> blockedChannels;

        RunResult(boolean iterationComplete, boolean progressMade, List<String> blockedChannels) {
            this.iterationComplete = iterationComplete;
            this.progressMade = progressMade;
            this.blockedChannels = blockedChannels;
        }

        public boolean isIterationComplete() { return iterationComplete; }
        public boolean isProgressMade() { return progressMade; }
        public List<String> getBlockedChannels() { return blockedChannels; }

        @Override
        public String toString() {
            return "RunResult{complete=" + iterationComplete + ", progress=" + progressMade
                    + ", blocked=" + blockedChannels + "}";
        }
    }

    /** 迭代被阻塞时用于跳出求值 */
    private static final class BlockedException extends RuntimeException {
        private final String channel;

        BlockedException(String channel) {
            super(null, null, false, false);
            this.channel = channel;
        }
    }

    private final IrProc proc;
    private final ChannelQueueManager queues;
    private final IrInterpreter functionInterpreter = new IrInterpreter();
    private final Map<String, IrValue> state = new LinkedHashMap<>();
    private int completedIterations;

    public ProcInterpreter(IrProc proc, ChannelQueueManager queues) {
        this.proc = proc;
        this.queues = queues;
        for (IrProc.StateElement e : proc.getStateElements()) {
            state.put(e.getName(), e.getInitialValue());
        }
    }

    /**
     * 执行一次迭代
     */
    public RunResult tick() {
        Map<String, Integer> readOffsets = new HashMap<>();
        Map<String, List<IrValue>> pendingSends = new LinkedHashMap<>();
        Map<IrNode, IrValue> values = new IdentityHashMap<>();
        try {
            for (IrNode node : proc.getNodes()) {
                values.put(node, evaluate(node, values, readOffsets, pendingSends));
            }
        } catch (BlockedException e) {
            LOG.fine(() -> "Proc " + proc.getName() + " blocked on " + e.channel);
            return new RunResult(false, false, Collections.singletonList(e.channel));
        }

        // 提交
        for (Map.Entry<String, Integer> read : readOffsets.entrySet()) {
            queues.getQueue(read.getKey()).consume(read.getValue());
        }
        for (Map.Entry<String, List<IrValue>> send : pendingSends.entrySet()) {
            ChannelQueue queue = queues.getQueue(send.getKey());
            for (IrValue v : send.getValue()) {
                queue.write(v);
            }
        }
        for (IrProc.StateElement e : proc.getStateElements()) {
            state.put(e.getName(), values.get(e.getNext()));
        }
        completedIterations++;
        return new RunResult(true, true, Collections.<String>emptyList());
    }

    /**
     * 连续执行直到阻塞或达到迭代上限，返回完成的迭代数
     */
    public int runUntilBlocked(int maxIterations) {
        int count = 0;
        while (count < maxIterations && tick().isIterationComplete()) {
            count++;
        }
        return count;
    }

    private IrValue evaluate(IrNode node, Map<IrNode, IrValue> values, Map<String, Integer> readOffsets,
                             Map<String, List<IrValue>> pendingSends) {
        switch (node.getOp()) {
            case STATE_READ:
                return state.get(node.getReference());
            case RECEIVE: {
                if (node.hasPredicate() && !values.get(node.getPredicate()).isTrue()) {
                    return IrValue.zero(node.getType());
                }
                String channel = node.getReference();
                int offset = readOffsets.containsKey(channel) ? readOffsets.get(channel) : 0;
                IrValue v = queues.getQueue(channel).peek(offset);
                if (v == null) {
                    throw new BlockedException(channel);
                }
                readOffsets.put(channel, offset + 1);
                return v;
            }
            case SEND: {
                if (!node.hasPredicate() || values.get(node.getPredicate()).isTrue()) {
                    IrValue data = values.get(node.getOperand(0));
                    List<IrValue> buffered = pendingSends.get(node.getReference());
                    if (buffered == null) {
                        buffered = new ArrayList<>();
                        pendingSends.put(node.getReference(), buffered);
                    }
                    buffered.add(data);
                }
                return IrValue.tuple(new ArrayList<IrValue>());
            }
            case INVOKE:
                return functionInterpreter.runKwargs(node.getCallee(),
                        IrInterpreter.bindArguments(node, IrInterpreter.operandValues(node, values)));
            case PARAM:
                throw new IrEvaluationException("Proc '" + proc.getName() + "' contains a param node");
            default:
                return NodeEvaluator.evaluate(node, IrInterpreter.operandValues(node, values));
        }
    }

    public IrValue getState(String name) {
        return state.get(name);
    }

    public Map<String, IrValue> getState() {
        return Collections.unmodifiableMap(state);
    }

    public int getCompletedIterations() {
        return completedIterations;
    }

    /** proc 引用的通道名 */
    public Set<String> getChannelNames() {
        return new LinkedHashSet<>(proc.getChannelNames());
    }
}
