package com.hlsflow.compiler.ast;

import java.util.List;

/**
 * 附着在声明或语句上的 #pragma 指令。
 *
 * <p>{@code #pragma hls_unroll yes} 解析为 name = "hls_unroll", arguments = ["yes"]。</p>
 */
public final class Pragma {
    public static final String TOP = "hls_top";
    public static final String UNROLL = "hls_unroll";
    public static final String NO_TUPLE = "hls_no_tuple";

    private final String name;
    private final List<String> arguments;
    private final SourceLocation location;

    public Pragma(String name, List<String> arguments, SourceLocation location) {
        this.name = name;
        this.arguments = arguments;
        this.location = location;
    }

    public String getName() {
        return name;
    }

    public List<String> getArguments() {
        return arguments;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public boolean is(String pragmaName) {
        return name.equals(pragmaName);
    }

    public static boolean contains(List<Pragma> pragmas, String pragmaName) {
        for (Pragma p : pragmas) {
            if (p.is(pragmaName)) {
                return true;
            }
        }
        return false;
    }

    public static Pragma find(List<Pragma> pragmas, String pragmaName) {
        for (Pragma p : pragmas) {
            if (p.is(pragmaName)) {
                return p;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "#pragma " + name + (arguments.isEmpty() ? "" : " " + String.join(" ", arguments));
    }
}
