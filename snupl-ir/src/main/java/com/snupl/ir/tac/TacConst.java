package com.snupl.ir.tac;

/**
 * 常量操作数
 */
public final class TacConst extends TacAddr {
    private final long value;

    public TacConst(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
