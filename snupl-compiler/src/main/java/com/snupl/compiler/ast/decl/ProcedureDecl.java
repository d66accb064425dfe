package com.snupl.compiler.ast.decl;

import com.snupl.compiler.analysis.ParameterSymbol;
import com.snupl.compiler.analysis.ProcedureSymbol;
import com.snupl.compiler.analysis.Symbol;
import com.snupl.compiler.analysis.SymbolKind;
import com.snupl.compiler.analysis.SymbolTable;
import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.lexer.Token;

/**
 * 过程/函数声明。符号表以外层作用域的符号表为父表，形参在构造时登记。
 */
public class ProcedureDecl extends AstScope {
    private final ProcedureSymbol symbol;

    public ProcedureDecl(AstContext context, Token token, AstScope parent, ProcedureSymbol symbol) {
        super(context, token, symbol.getName(), requireParent(parent),
                new SymbolTable(parent.getSymbolTable()));
        this.symbol = symbol;
        for (ParameterSymbol p : symbol.getParameters()) {
            if (!getSymbolTable().define(p)) {
                throw new IllegalArgumentException("duplicate parameter '" + p.getName()
                        + "' in procedure '" + symbol.getName() + "'");
            }
        }
    }

    private static AstScope requireParent(AstScope parent) {
        if (parent == null) {
            throw new IllegalArgumentException("procedure requires an enclosing scope");
        }
        return parent;
    }

    public ProcedureSymbol getSymbol() {
        return symbol;
    }

    @Override
    public Symbol createVar(String name, Type type) {
        return new Symbol(name, SymbolKind.LOCAL, type);
    }

    /** 过程的类型即其返回类型 */
    @Override
    public Type getType() {
        return symbol.getReturnType();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProcedureDecl(this, context);
    }
}
