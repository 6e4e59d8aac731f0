package com.hlsflow.translator.block;

import com.google.gson.annotations.SerializedName;

/**
 * 块描述中的一个端口
 */
public final class HlsChannel {

    private String name;

    @SerializedName("is_input")
    private boolean input;

    private HlsChannelType type;

    /** gson 反序列化使用 */
    private HlsChannel() {
    }

    public HlsChannel(String name, boolean input, HlsChannelType type) {
        this.name = name;
        this.input = input;
        this.type = type;
    }

    public static HlsChannel fifoIn(String name) {
        return new HlsChannel(name, true, HlsChannelType.FIFO);
    }

    public static HlsChannel fifoOut(String name) {
        return new HlsChannel(name, false, HlsChannelType.FIFO);
    }

    public static HlsChannel directIn(String name) {
        return new HlsChannel(name, true, HlsChannelType.DIRECT_IN);
    }

    public String getName() {
        return name;
    }

    public boolean isInput() {
        return input;
    }

    public HlsChannelType getType() {
        return type;
    }

    @Override
    public String toString() {
        return name + (input ? " <- " : " -> ") + type;
    }
}
