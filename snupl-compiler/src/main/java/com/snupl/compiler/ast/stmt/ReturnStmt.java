package com.snupl.compiler.ast.stmt;

import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.ast.decl.AstScope;
import com.snupl.compiler.ast.expr.Expression;
import com.snupl.compiler.lexer.Token;

/**
 * return 语句。scope 指向所在作用域，用于检查返回类型。
 */
public class ReturnStmt extends Statement {
    private final AstScope scope;
    private final Expression value;   // 可为 null

    public ReturnStmt(AstContext context, Token token, AstScope scope, Expression value) {
        super(context, token);
        this.scope = scope;
        this.value = value;
    }

    public AstScope getScope() {
        return scope;
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public Type getType() {
        return value != null ? value.getType() : Types.NULL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitReturnStmt(this, context);
    }
}
