package com.snupl.compiler.ast.stmt;

import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.ast.expr.Designator;
import com.snupl.compiler.ast.expr.Expression;
import com.snupl.compiler.lexer.Token;

/**
 * 赋值语句 target := value
 */
public class AssignStmt extends Statement {
    private final Designator target;
    private final Expression value;

    public AssignStmt(AstContext context, Token token, Designator target, Expression value) {
        super(context, token);
        this.target = target;
        this.value = value;
    }

    public Designator getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public Type getType() {
        return target.getType();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
