package com.snupl.compiler.ast;

/**
 * 一次编译的 AST 构建上下文。
 *
 * <p>持有节点编号和合成字符串符号编号两个单调计数器，
 * 每个编译单元一个实例，不在线程间共享。</p>
 */
public final class AstContext {
    private int nextNodeId = 0;
    private int nextStringIndex = 0;

    public int nextNodeId() {
        return nextNodeId++;
    }

    /** 字符串常量编号从 1 开始 */
    public int nextStringIndex() {
        return ++nextStringIndex;
    }
}
