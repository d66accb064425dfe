package com.snupl.compiler.ast.stmt;

import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstNode;
import com.snupl.compiler.lexer.Token;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(AstContext context, Token token) {
        super(context, token);
    }
}
