package com.snupl.compiler.ast.stmt;

import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.ast.expr.FunctionCall;
import com.snupl.compiler.lexer.Token;

/**
 * 过程调用语句，返回值被丢弃
 */
public class CallStmt extends Statement {
    private final FunctionCall call;

    public CallStmt(AstContext context, Token token, FunctionCall call) {
        super(context, token);
        this.call = call;
    }

    public FunctionCall getCall() {
        return call;
    }

    @Override
    public Type getType() {
        return call.getType();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallStmt(this, context);
    }
}
