package com.snupl.compiler.ast.expr;

import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.lexer.Token;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(AstContext context, Token token, BinaryOp operator, Expression left, Expression right) {
        super(context, token);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public Type getType() {
        return operator.isArithmetic() ? Types.INTEGER : Types.BOOLEAN;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),

        // 逻辑
        AND("&&"),
        OR("||"),

        // 相等
        EQUAL("="),
        NOT_EQUAL("#"),

        // 比较
        LESS_THAN("<"),
        LESS_EQUAL("<="),
        BIGGER_THAN(">"),
        BIGGER_EQUAL(">=");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回 SnuPL 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public boolean isArithmetic() {
            return this == ADD || this == SUB || this == MUL || this == DIV;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }

        public boolean isEquality() {
            return this == EQUAL || this == NOT_EQUAL;
        }

        public boolean isRelational() {
            return this == LESS_THAN || this == LESS_EQUAL || this == BIGGER_THAN || this == BIGGER_EQUAL;
        }

        /** 按源码运算符查找，未知时返回 null */
        public static BinaryOp fromSource(String source) {
            for (BinaryOp op : values()) {
                if (op.source.equals(source)) return op;
            }
            return null;
        }
    }
}
