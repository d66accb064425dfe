package com.snupl.compiler.lexer;

/**
 * 词法单元
 *
 * <p>语义分析只需要词素和位置，用于诊断定位。</p>
 */
public final class Token {
    private final String lexeme;
    private final int line;
    private final int column;

    public Token(String lexeme, int line, int column) {
        this.lexeme = lexeme;
        this.line = line;
        this.column = column;
    }

    /** 无源码位置的合成词法单元 */
    public static Token synthetic(String lexeme) {
        return new Token(lexeme, 0, 0);
    }

    public String getLexeme() {
        return lexeme;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasPosition() {
        return line > 0;
    }

    @Override
    public String toString() {
        return String.format("'%s' at %d:%d", lexeme, line, column);
    }
}
