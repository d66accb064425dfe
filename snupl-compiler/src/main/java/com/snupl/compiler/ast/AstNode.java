package com.snupl.compiler.ast;

import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.lexer.Token;

/**
 * AST 节点基类
 */
public abstract class AstNode {
    private final int id;
    protected final Token token;

    protected AstNode(AstContext context, Token token) {
        this.id = context.nextNodeId();
        this.token = token;
    }

    /** 编译单元内唯一的节点编号 */
    public int getId() {
        return id;
    }

    public Token getToken() {
        return token;
    }

    /**
     * 节点的静态类型，无法确定时返回 null。
     * 纯计算，不修改节点。
     */
    public abstract Type getType();

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
