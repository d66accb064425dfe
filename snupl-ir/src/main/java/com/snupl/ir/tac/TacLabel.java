package com.snupl.ir.tac;

/**
 * 标签：作为指令放入指令序列，同时作为跳转目标
 */
public final class TacLabel extends TacInstr {
    private final String name;

    TacLabel(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name + ":";
    }
}
