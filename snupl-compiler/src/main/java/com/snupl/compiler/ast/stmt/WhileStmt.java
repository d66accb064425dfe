package com.snupl.compiler.ast.stmt;

import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.ast.expr.Expression;
import com.snupl.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * while 循环
 */
public class WhileStmt extends Statement {
    private final Expression condition;
    private final List<Statement> body;

    public WhileStmt(AstContext context, Token token, Expression condition, List<Statement> body) {
        super(context, token);
        this.condition = condition;
        this.body = new ArrayList<Statement>(body);
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getBody() {
        return Collections.unmodifiableList(body);
    }

    @Override
    public Type getType() {
        return Types.NULL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }
}
