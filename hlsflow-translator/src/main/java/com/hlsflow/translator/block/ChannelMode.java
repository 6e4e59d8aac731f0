package com.hlsflow.translator.block;

/**
 * FIFO 端口在包中的通道种类
 */
public enum ChannelMode {
    /** 每个操作一个流式端口操作 */
    ALL_STREAMING,
    /** 单值通道，同一通道上的操作合并 */
    ALL_SINGLE_VALUE
}
