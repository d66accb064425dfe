package com.snupl.compiler.ast.expr;

import com.snupl.compiler.analysis.Symbol;
import com.snupl.compiler.analysis.SymbolKind;
import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.ast.decl.AstScope;
import com.snupl.compiler.formatter.SnuplStringUtils;
import com.snupl.compiler.lexer.Token;

/**
 * 字符串字面量。
 *
 * <p>构造时合成全局符号 {@code _str_<n>}（类型 char[长度+1]，初始值为转义后的文本）
 * 并登记到给定作用域的符号表。</p>
 */
public class StringConstant extends Expression {
    private final String value;       // 转义形式
    private final Type type;
    private final Symbol symbol;

    public StringConstant(AstContext context, Token token, String value, AstScope scope) {
        super(context, token);
        this.value = value;
        this.type = Types.arrayOf(SnuplStringUtils.unescape(value).length() + 1, Types.CHAR);
        this.symbol = new Symbol("_str_" + context.nextStringIndex(), SymbolKind.GLOBAL, type, value);
        if (!scope.getSymbolTable().define(symbol)) {
            throw new IllegalStateException("string symbol '" + symbol.getName() + "' already defined");
        }
    }

    /** 转义形式的字符串内容 */
    public String getValue() {
        return value;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    @Override
    public Type getType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStringConstant(this, context);
    }
}
