package com.snupl.compiler.analysis;

import com.snupl.compiler.analysis.types.Type;

/**
 * 过程形参
 */
public final class ParameterSymbol extends Symbol {
    private final int index;

    public ParameterSymbol(String name, Type dataType, int index) {
        super(name, SymbolKind.PARAMETER, dataType);
        this.index = index;
    }

    public int getIndex() { return index; }
}
