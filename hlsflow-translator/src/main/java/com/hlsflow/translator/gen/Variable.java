package com.hlsflow.translator.gen;

import com.hlsflow.ir.node.IrNode;
import com.hlsflow.translator.types.CType;

/**
 * 作用域中的符号。
 *
 * <p>VALUE 持有当前值，赋值即重新绑定；REFERENCE 指向另一个左值；
 * CHANNEL 是通道参数（携带物理通道名）；CHANNEL_ALIAS 是局部通道别名，不能做 IO。</p>
 */
public final class Variable {

    public enum Kind {
        VALUE, REFERENCE, CHANNEL, CHANNEL_ALIAS
    }

    private final String name;
    private final CType type;
    private final Kind kind;
    /** 读写集合中使用的存储根 */
    private final String root;
    private IrNode value;
    private LValue target;
    private String channel;
    /** 循环归纳变量在循环体内锁定 */
    private boolean locked;

    Variable(String name, CType type, Kind kind, String root) {
        this.name = name;
        this.type = type;
        this.kind = kind;
        this.root = root;
    }

    public String getName() { return name; }
    public CType getType() { return type; }
    public Kind getKind() { return kind; }
    public String getRoot() { return root; }

    public IrNode getValue() {
        return value;
    }

    void setValue(IrNode value) {
        this.value = value;
    }

    public LValue getTarget() {
        return target;
    }

    void setTarget(LValue target) {
        this.target = target;
    }

    public String getChannel() {
        return channel;
    }

    void setChannel(String channel) {
        this.channel = channel;
    }

    public boolean isLocked() {
        return locked;
    }

    void setLocked(boolean locked) {
        this.locked = locked;
    }

    public boolean isChannel() {
        return kind == Kind.CHANNEL || kind == Kind.CHANNEL_ALIAS;
    }

    @Override
    public String toString() {
        return kind + " " + name + " : " + type;
    }
}
