package com.snupl.compiler.ast.expr;

import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.lexer.Token;

/**
 * 一元表达式
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpr(AstContext context, Token token, UnaryOp operator, Expression operand) {
        super(context, token);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public Type getType() {
        return operator == UnaryOp.NOT ? Types.BOOLEAN : Types.INTEGER;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpr(this, context);
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        NEG("-"),
        POS("+"),
        NOT("!");

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }

        public static UnaryOp fromSource(String source) {
            for (UnaryOp op : values()) {
                if (op.source.equals(source)) return op;
            }
            return null;
        }
    }
}
