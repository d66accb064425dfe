package com.snupl.cli;

/**
 * JSON AST 格式错误：未知节点类型、类型语法错误、未声明的名字等
 */
public class AstFormatException extends RuntimeException {
    private final int line;
    private final int column;

    public AstFormatException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public AstFormatException(String message, Throwable cause) {
        super(message, cause);
        this.line = 0;
        this.column = 0;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String getMessage() {
        if (line > 0) {
            return super.getMessage() + " at line " + line + ", column " + column;
        }
        return super.getMessage();
    }
}
