package com.snupl.compiler.ast.expr;

import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstNode;
import com.snupl.compiler.lexer.Token;

/**
 * 表达式基类。类型按需计算，不缓存。
 */
public abstract class Expression extends AstNode {

    protected Expression(AstContext context, Token token) {
        super(context, token);
    }
}
