package com.hlsflow.compiler.ast.type;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 语言内置的类型名：通道模板与定宽整数别名
 */
public final class BuiltinNames {

    /** 硬件通道模板：__hls_channel&lt;T&gt;，提供 read() / write(v) */
    public static final String CHANNEL = "__hls_channel";
    public static final String CHANNEL_READ = "read";
    public static final String CHANNEL_WRITE = "write";

    /** 定宽别名 → {位宽, 是否无符号(1/0)} */
    public static final Map<String, int[]> FIXED_WIDTH_ALIASES;

    static {
        Map<String, int[]> map = new LinkedHashMap<>();
        map.put("int8_t", new int[]{8, 0});
        map.put("int16_t", new int[]{16, 0});
        map.put("int32_t", new int[]{32, 0});
        map.put("int64_t", new int[]{64, 0});
        map.put("uint8_t", new int[]{8, 1});
        map.put("uint16_t", new int[]{16, 1});
        map.put("uint32_t", new int[]{32, 1});
        map.put("uint64_t", new int[]{64, 1});
        map.put("size_t", new int[]{64, 1});
        FIXED_WIDTH_ALIASES = Collections.unmodifiableMap(map);
    }

    private BuiltinNames() {
    }
}
