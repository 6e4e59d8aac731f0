package com.hlsflow.ir;

import com.hlsflow.ir.type.IrType;

/**
 * 包级通道声明。
 */
public final class IrChannel {

    public enum Kind {
        /** FIFO 语义，读消耗 */
        STREAMING,
        /** 单值寄存器语义，读不消耗，写覆盖 */
        SINGLE_VALUE
    }

    public enum Direction {
        IN, OUT
    }

    private final String name;
    private final IrType type;
    private final Kind kind;
    private final Direction direction;

    public IrChannel(String name, IrType type, Kind kind, Direction direction) {
        this.name = name;
        this.type = type;
        this.kind = kind;
        this.direction = direction;
    }

    public String getName() { return name; }
    public IrType getType() { return type; }
    public Kind getKind() { return kind; }
    public Direction getDirection() { return direction; }

    @Override
    public String toString() {
        return "chan " + name + "(" + type + ", kind=" + kind.name().toLowerCase()
                + ", direction=" + direction.name().toLowerCase() + ")";
    }
}
