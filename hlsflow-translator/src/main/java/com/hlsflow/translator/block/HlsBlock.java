package com.hlsflow.translator.block;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * proc 的端口描述：块名与各端口。
 *
 * <pre>
 * {"name": "foo",
 *  "channels": [{"name": "in", "is_input": true, "type": "FIFO"},
 *               {"name": "out", "is_input": false, "type": "FIFO"}]}
 * </pre>
 */
public final class HlsBlock {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private String name;
    private List<HlsChannel> channels = new ArrayList<>();

    /** gson 反序列化使用 */
    private HlsBlock() {
    }

    public HlsBlock(String name, List<HlsChannel> channels) {
        this.name = name;
        this.channels = new ArrayList<>(channels);
        validate();
    }

    /**
     * 读取 JSON 块描述
     *
     * @throws IllegalArgumentException JSON 格式错误或描述不完整
     */
    public static HlsBlock fromJson(Reader reader) {
        HlsBlock block;
        try {
            block = GSON.fromJson(reader, HlsBlock.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid block description: " + e.getMessage(), e);
        }
        if (block == null) {
            throw new IllegalArgumentException("Invalid block description: empty input");
        }
        if (block.channels == null) {
            block.channels = new ArrayList<>();
        }
        block.validate();
        return block;
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    private void validate() {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Block description has no name");
        }
        Set<String> seen = new HashSet<>();
        for (HlsChannel channel : channels) {
            if (channel == null || channel.getName() == null || channel.getType() == null) {
                throw new IllegalArgumentException("Channel of block '" + name + "' needs a name and a type");
            }
            if (!seen.add(channel.getName())) {
                throw new IllegalArgumentException("Duplicate channel '" + channel.getName() + "' in block '" + name + "'");
            }
            if (channel.getType() == HlsChannelType.DIRECT_IN && !channel.isInput()) {
                throw new IllegalArgumentException("Direct channel '" + channel.getName() + "' must be an input");
            }
        }
    }

    public String getName() {
        return name;
    }

    public List<HlsChannel> getChannels() {
        return Collections.unmodifiableList(channels);
    }

    public HlsChannel getChannel(String channelName) {
        for (HlsChannel c : channels) {
            if (c.getName().equals(channelName)) {
                return c;
            }
        }
        return null;
    }
}
