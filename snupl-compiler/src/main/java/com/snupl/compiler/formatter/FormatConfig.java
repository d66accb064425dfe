package com.snupl.compiler.formatter;

/**
 * 树形转储配置
 */
public class FormatConfig {
    private int indentSize = 2;
    private boolean printSymbolTables = true;

    public FormatConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        this.indentSize = indentSize;
    }

    public boolean isPrintSymbolTables() {
        return printSymbolTables;
    }

    public void setPrintSymbolTables(boolean printSymbolTables) {
        this.printSymbolTables = printSymbolTables;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentSize; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
