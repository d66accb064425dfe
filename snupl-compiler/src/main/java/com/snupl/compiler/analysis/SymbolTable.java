package com.snupl.compiler.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 符号表。过程的符号表以外层作用域的符号表为父表，实现词法嵌套的名字解析。
 */
public final class SymbolTable {
    private final SymbolTable parent;
    private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();

    public SymbolTable() {
        this(null);
    }

    public SymbolTable(SymbolTable parent) {
        this.parent = parent;
    }

    public SymbolTable getParent() { return parent; }

    /**
     * 注册符号到当前表
     *
     * @return 同名符号已存在时返回 false，不覆盖
     */
    public boolean define(Symbol symbol) {
        if (symbols.containsKey(symbol.getName())) {
            return false;
        }
        symbols.put(symbol.getName(), symbol);
        return true;
    }

    /** 从当前表向上查找 */
    public Symbol resolve(String name) {
        Symbol s = symbols.get(name);
        if (s != null) return s;
        if (parent != null) return parent.resolve(name);
        return null;
    }

    /** 仅查找当前表 */
    public Symbol resolveLocal(String name) {
        return symbols.get(name);
    }

    /** 按定义顺序列出当前表的符号 */
    public List<Symbol> getSymbols() {
        return new ArrayList<Symbol>(symbols.values());
    }

    public int size() {
        return symbols.size();
    }
}
