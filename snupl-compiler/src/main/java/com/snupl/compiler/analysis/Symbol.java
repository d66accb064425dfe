package com.snupl.compiler.analysis;

import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.analysis.types.Types;

/**
 * 符号表中的符号
 */
public class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final Type dataType;
    private final String data;            // 全局数据初始值（转义后的字符串），可为 null

    public Symbol(String name, SymbolKind kind, Type dataType) {
        this(name, kind, dataType, null);
    }

    public Symbol(String name, SymbolKind kind, Type dataType, String data) {
        this.name = name;
        this.kind = kind;
        this.dataType = dataType;
        this.data = data;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public Type getDataType() { return dataType; }
    public String getData() { return data; }

    public boolean isPointer() {
        return dataType != null && dataType.isPointer();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(kind.name().toLowerCase()).append(' ').append(name)
                .append(": ").append(Types.nameOf(dataType));
        if (data != null) {
            sb.append(" = \"").append(data).append('"');
        }
        return sb.append(']').toString();
    }
}
