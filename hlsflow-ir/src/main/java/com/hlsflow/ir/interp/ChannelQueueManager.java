package com.hlsflow.ir.interp;

import com.hlsflow.ir.IrChannel;
import com.hlsflow.ir.IrPackage;
import com.hlsflow.ir.value.IrValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 包内全部通道的队列。
 */
public class ChannelQueueManager {

    private final Map<String, ChannelQueue> queues = new LinkedHashMap<>();

    public ChannelQueueManager(IrPackage pkg) {
        for (IrChannel channel : pkg.getChannels()) {
            queues.put(channel.getName(), new ChannelQueue(channel));
        }
    }

    public ChannelQueue getQueue(String channelName) {
        ChannelQueue queue = queues.get(channelName);
        if (queue == null) {
            throw new IrEvaluationException("No such channel: " + channelName);
        }
        return queue;
    }

    public boolean hasQueue(String channelName) {
        return queues.containsKey(channelName);
    }

    public List<ChannelQueue> getQueues() {
        return new ArrayList<>(queues.values());
    }

    /** 便捷写入 */
    public void write(String channelName, IrValue value) {
        getQueue(channelName).write(value);
    }

    /** 便捷读出全部值 */
    public List<IrValue> drain(String channelName) {
        return getQueue(channelName).drain();
    }
}
