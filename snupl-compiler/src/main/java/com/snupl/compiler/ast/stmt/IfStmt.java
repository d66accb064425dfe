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
 * if 语句，else 分支可以为空
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final List<Statement> thenBody;
    private final List<Statement> elseBody;

    public IfStmt(AstContext context, Token token, Expression condition,
                  List<Statement> thenBody, List<Statement> elseBody) {
        super(context, token);
        this.condition = condition;
        this.thenBody = new ArrayList<Statement>(thenBody);
        this.elseBody = elseBody != null ? new ArrayList<Statement>(elseBody) : new ArrayList<Statement>();
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getThenBody() {
        return Collections.unmodifiableList(thenBody);
    }

    public List<Statement> getElseBody() {
        return Collections.unmodifiableList(elseBody);
    }

    @Override
    public Type getType() {
        return Types.NULL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
