package com.snupl.compiler.ast.expr;

import com.snupl.compiler.analysis.ProcedureSymbol;
import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 过程/函数调用
 */
public class FunctionCall extends Expression {
    private final ProcedureSymbol symbol;
    private final List<Expression> arguments = new ArrayList<Expression>();

    public FunctionCall(AstContext context, Token token, ProcedureSymbol symbol) {
        super(context, token);
        this.symbol = symbol;
    }

    public ProcedureSymbol getSymbol() {
        return symbol;
    }

    public void addArgument(Expression arg) {
        arguments.add(arg);
    }

    public List<Expression> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public int getArgumentCount() {
        return arguments.size();
    }

    public Expression getArgument(int index) {
        return arguments.get(index);
    }

    @Override
    public Type getType() {
        return symbol.getReturnType();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionCall(this, context);
    }
}
