package com.snupl.compiler.ast.expr;

import com.snupl.compiler.analysis.types.PointerType;
import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.lexer.Token;

/**
 * 特殊运算：取地址、解引用、类型转换。只有类型转换携带目标类型。
 */
public class SpecialExpr extends Expression {
    private final SpecialOp operator;
    private final Expression operand;
    private final Type castType;

    public SpecialExpr(AstContext context, Token token, SpecialOp operator, Expression operand, Type castType) {
        super(context, token);
        if ((operator == SpecialOp.CAST) != (castType != null)) {
            throw new IllegalArgumentException("cast type is required for CAST and only for CAST");
        }
        this.operator = operator;
        this.operand = operand;
        this.castType = castType;
    }

    public SpecialOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    public Type getCastType() {
        return castType;
    }

    @Override
    public Type getType() {
        Type operandType = operand.getType();
        switch (operator) {
            case ADDRESS:
                return operandType != null ? Types.pointerTo(operandType) : null;
            case DEREF:
                return operandType instanceof PointerType ? ((PointerType) operandType).getBaseType() : null;
            case CAST:
                return castType;
            default:
                return null;
        }
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSpecialExpr(this, context);
    }

    /**
     * 特殊运算符
     */
    public enum SpecialOp {
        ADDRESS("&()"),
        DEREF("*()"),
        CAST("cast");

        private final String source;

        SpecialOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }
    }
}
