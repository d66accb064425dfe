package com.snupl.compiler.ast.expr;

import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.analysis.types.Types;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.formatter.SnuplStringUtils;
import com.snupl.compiler.lexer.Token;

/**
 * 整数、布尔、字符字面量。值以 64 位保存，2^31 这样的越界值由类型检查拒绝。
 */
public class Constant extends Expression {
    private final Type type;
    private final long value;

    public Constant(AstContext context, Token token, Type type, long value) {
        super(context, token);
        this.type = type;
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    /** 源码形式的值 */
    public String getValueString() {
        if (Types.isBoolean(type)) {
            return value != 0 ? "true" : "false";
        }
        if (type != null && type.match(Types.CHAR)) {
            return "'" + SnuplStringUtils.escapeChar((char) value) + "'";
        }
        return Long.toString(value);
    }

    @Override
    public Type getType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConstant(this, context);
    }
}
