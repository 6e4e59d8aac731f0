package com.hlsflow.translator.block;

/**
 * 端口类型：FIFO 对应通道形参，DIRECT_IN 对应值形参
 */
public enum HlsChannelType {
    FIFO,
    DIRECT_IN
}
