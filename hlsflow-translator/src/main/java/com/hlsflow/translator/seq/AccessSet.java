package com.hlsflow.translator.seq;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 一个子表达式可能读写的存储根。
 *
 * <p>变量根形如 {@code ctx:name#serial}，通道根形如 {@code channel:name}。</p>
 */
public final class AccessSet {

    private static final String CHANNEL_PREFIX = "channel:";

    private final Set<String> reads = new LinkedHashSet<>();
    private final Set<String> writes = new LinkedHashSet<>();
    /** 是否包含赋值或自增自减 */
    private boolean assigns;

    public static String variableRoot(int contextId, String name, int serial) {
        return contextId + ":" + name + "#" + serial;
    }

    public static String channelRoot(String channel) {
        return CHANNEL_PREFIX + channel;
    }

    /** 报错用的源码名 */
    public static String displayName(String root) {
        if (root.startsWith(CHANNEL_PREFIX)) {
            return root.substring(CHANNEL_PREFIX.length());
        }
        int colon = root.indexOf(':');
        int hash = root.lastIndexOf('#');
        return hash > colon ? root.substring(colon + 1, hash) : root;
    }

    void addRead(String root) {
        reads.add(root);
    }

    void addWrite(String root) {
        writes.add(root);
    }

    void markAssignment() {
        assigns = true;
    }

    public Set<String> getReads() {
        return reads;
    }

    public Set<String> getWrites() {
        return writes;
    }

    public boolean hasAssignments() {
        return assigns;
    }

    /**
     * 与另一兄弟表达式冲突的根：写写或读写重叠；无冲突返回 null
     */
    public String conflictWith(AccessSet other) {
        for (String w : writes) {
            if (other.writes.contains(w) || other.reads.contains(w)) {
                return w;
            }
        }
        for (String w : other.writes) {
            if (reads.contains(w)) {
                return w;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "reads=" + reads + " writes=" + writes;
    }
}
