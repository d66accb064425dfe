package com.snupl.compiler.analysis;

import com.snupl.compiler.lexer.Token;

/**
 * 语义诊断条目
 */
public final class SemanticDiagnostic {

    public enum Severity {
        ERROR, WARNING
    }

    private final Severity severity;
    private final ErrorKind kind;
    private final String message;
    private final Token token;

    public SemanticDiagnostic(Severity severity, ErrorKind kind, String message, Token token) {
        this.severity = severity;
        this.kind = kind;
        this.message = message;
        this.token = token;
    }

    static SemanticDiagnostic of(SemanticException e) {
        return new SemanticDiagnostic(Severity.ERROR, e.getKind(), e.getDetail(), e.getToken());
    }

    public Severity getSeverity() { return severity; }
    public ErrorKind getKind() { return kind; }
    public String getMessage() { return message; }
    public Token getToken() { return token; }

    @Override
    public String toString() {
        if (token == null) {
            return severity + ": " + message;
        }
        return severity + " " + token.getLine() + ":" + token.getColumn() + ": " + message;
    }
}
