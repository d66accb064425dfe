package com.snupl.compiler.analysis;

import com.snupl.compiler.lexer.Token;

/**
 * 语义异常：类型检查遇到的第一个错误
 */
public class SemanticException extends RuntimeException {
    private final Token token;
    private final ErrorKind kind;

    public SemanticException(ErrorKind kind, String message, Token token) {
        super(message);
        this.kind = kind;
        this.token = token;
    }

    public Token getToken() {
        return token;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** 不带位置信息的诊断消息 */
    public String getDetail() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            sb.append(" (found '").append(token.getLexeme()).append("')");
        }
        return sb.toString();
    }
}
