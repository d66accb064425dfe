package com.snupl.ir.tac;

import com.snupl.compiler.analysis.Symbol;

/**
 * 具名操作数：变量、参数、过程或合成的全局数据
 */
public class TacName extends TacAddr {
    private final Symbol symbol;

    public TacName(Symbol symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("symbol must not be null");
        }
        this.symbol = symbol;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return symbol.getName();
    }
}
