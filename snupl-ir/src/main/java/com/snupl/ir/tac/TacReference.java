package com.snupl.ir.tac;

import com.snupl.compiler.analysis.Symbol;

/**
 * 内存引用 @addr：读写 address 所指的位置。
 * symbol 是被访问的原始变量（数组或指针），用于确定元素类型。
 */
public final class TacReference extends TacAddr {
    private final TacName address;
    private final Symbol symbol;

    public TacReference(TacName address, Symbol symbol) {
        this.address = address;
        this.symbol = symbol;
    }

    public TacName getAddress() {
        return address;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return "@" + address;
    }
}
