package com.hlsflow.translator.io;

import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.ir.IrBuilder;
import com.hlsflow.ir.IrChannel;
import com.hlsflow.ir.node.IrNode;
import com.hlsflow.translator.TranslationException;

import java.util.Map;

/**
 * proc 流式模式：每个操作就地成为一个端口操作，谓词为其激活条件（恒真时省略）
 */
public final class StreamingIoBackend implements IoBackend {

    private final IrBuilder builder;
    private final Map<String, IrChannel> channels;

    public StreamingIoBackend(IrBuilder builder, Map<String, IrChannel> channels) {
        this.builder = builder;
        this.channels = channels;
    }

    @Override
    public IrNode receive(IoOp op) {
        requireDirection(channels, op, IrChannel.Direction.IN);
        return builder.receive(op.getChannel(), op.getPayloadType().toIrType(), predicate(op.getCondition()));
    }

    @Override
    public void send(IoOp op) {
        requireDirection(channels, op, IrChannel.Direction.OUT);
        builder.send(op.getChannel(), op.getPayload(), predicate(op.getCondition()));
    }

    static IrNode predicate(IrNode condition) {
        return IrBuilder.isLiteralTrue(condition) ? null : condition;
    }

    static void requireDirection(Map<String, IrChannel> channels, IoOp op, IrChannel.Direction direction) {
        IrChannel channel = channels.get(op.getChannel());
        if (channel == null) {
            throw TranslationException.notFound("Channel '" + op.getChannel() + "' not found in block",
                    SourceLocation.UNKNOWN);
        }
        if (channel.getDirection() != direction) {
            throw TranslationException.channelUsage("Channel '" + op.getChannel() + "' is an "
                    + (channel.getDirection() == IrChannel.Direction.IN ? "input" : "output")
                    + " and cannot be " + (op.isReceive() ? "read" : "written"), SourceLocation.UNKNOWN);
        }
    }
}
