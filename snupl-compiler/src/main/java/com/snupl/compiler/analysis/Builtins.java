package com.snupl.compiler.analysis;

import com.snupl.compiler.analysis.types.ArrayType;
import com.snupl.compiler.analysis.types.Types;

/**
 * 预定义的 I/O 过程
 */
public final class Builtins {

    private Builtins() {}

    public static void register(SymbolTable table) {
        table.define(new ProcedureSymbol("ReadInt", Types.INTEGER));

        ProcedureSymbol writeInt = new ProcedureSymbol("WriteInt", Types.NULL);
        writeInt.addParameter("i", Types.INTEGER);
        table.define(writeInt);

        ProcedureSymbol writeChar = new ProcedureSymbol("WriteChar", Types.NULL);
        writeChar.addParameter("c", Types.CHAR);
        table.define(writeChar);

        ProcedureSymbol writeStr = new ProcedureSymbol("WriteStr", Types.NULL);
        writeStr.addParameter("str", Types.pointerTo(Types.arrayOf(ArrayType.OPEN, Types.CHAR)));
        table.define(writeStr);

        table.define(new ProcedureSymbol("WriteLn", Types.NULL));
    }
}
