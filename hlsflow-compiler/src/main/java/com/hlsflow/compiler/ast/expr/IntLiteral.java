package com.hlsflow.compiler.ast.expr;

import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;

/**
 * 整数 / 字符字面量
 */
public class IntLiteral extends Expression {
    private final long value;
    private final boolean unsigned;
    /** 后缀中 l 的个数：0 为 int，1 为 long，2 为 long long */
    private final int longCount;
    private final boolean character;
    /** 十进制字面量在 C++ 中不会选择 unsigned 类型 */
    private final boolean decimal;

    public IntLiteral(SourceLocation location, long value, boolean unsigned, int longCount,
                      boolean character, boolean decimal) {
        super(location);
        this.value = value;
        this.unsigned = unsigned;
        this.longCount = longCount;
        this.character = character;
        this.decimal = decimal;
    }

    public long getValue() {
        return value;
    }

    public boolean isUnsigned() {
        return unsigned;
    }

    public int getLongCount() {
        return longCount;
    }

    public boolean isCharacter() {
        return character;
    }

    public boolean isDecimal() {
        return decimal;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIntLiteral(this, context);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
