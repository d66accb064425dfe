package com.snupl.compiler.ast.expr;

import com.snupl.compiler.analysis.Symbol;
import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.lexer.Token;

/**
 * 变量引用
 */
public class Designator extends Expression {
    protected final Symbol symbol;

    public Designator(AstContext context, Token token, Symbol symbol) {
        super(context, token);
        this.symbol = symbol;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    @Override
    public Type getType() {
        return symbol.getDataType();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDesignator(this, context);
    }
}
