package com.snupl.ir.tac;

import com.snupl.compiler.analysis.Symbol;

/**
 * 临时变量，由 {@link CodeBlock#createTemp} 分配
 */
public final class TacTemp extends TacName {

    public TacTemp(Symbol symbol) {
        super(symbol);
    }
}
