package com.snupl.compiler.analysis;

import com.snupl.compiler.analysis.types.Types;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("符号表")
class SymbolTableTest {

    @Test
    @DisplayName("同一表内拒绝重复定义")
    void testRejectsDuplicates() {
        SymbolTable table = new SymbolTable();
        Symbol first = new Symbol("a", SymbolKind.GLOBAL, Types.INTEGER);
        assertThat(table.define(first)).isTrue();
        assertThat(table.define(new Symbol("a", SymbolKind.GLOBAL, Types.CHAR))).isFalse();
        assertThat(table.resolve("a")).isSameAs(first);
    }

    @Test
    @DisplayName("沿父表链解析，内层遮蔽外层")
    void testResolveThroughParent() {
        SymbolTable outer = new SymbolTable();
        SymbolTable inner = new SymbolTable(outer);
        Symbol outerA = new Symbol("a", SymbolKind.GLOBAL, Types.INTEGER);
        Symbol outerB = new Symbol("b", SymbolKind.GLOBAL, Types.INTEGER);
        Symbol innerA = new Symbol("a", SymbolKind.LOCAL, Types.CHAR);
        outer.define(outerA);
        outer.define(outerB);
        inner.define(innerA);

        assertThat(inner.resolve("a")).isSameAs(innerA);
        assertThat(inner.resolve("b")).isSameAs(outerB);
        assertThat(inner.resolveLocal("b")).isNull();
        assertThat(inner.resolve("missing")).isNull();
    }

    @Test
    @DisplayName("按定义顺序列出符号")
    void testOrder() {
        SymbolTable table = new SymbolTable();
        Builtins.register(table);
        assertThat(table.getSymbols()).extracting(Symbol::getName)
                .containsExactly("ReadInt", "WriteInt", "WriteChar", "WriteStr", "WriteLn");
        ProcedureSymbol writeStr = (ProcedureSymbol) table.resolve("WriteStr");
        assertThat(writeStr.isFunction()).isFalse();
        assertThat(writeStr.getParameter(0).getDataType().toDisplayString()).isEqualTo("^char[]");
        assertThat(((ProcedureSymbol) table.resolve("ReadInt")).getReturnType()).isSameAs(Types.INTEGER);
    }
}
