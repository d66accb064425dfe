package com.snupl.compiler.ast.expr;

import com.snupl.compiler.analysis.Symbol;
import com.snupl.compiler.analysis.types.ArrayType;
import com.snupl.compiler.analysis.types.PointerType;
import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.ast.AstContext;
import com.snupl.compiler.ast.AstVisitor;
import com.snupl.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 数组元素引用 a[i][j]。
 *
 * <p>下标逐个追加，{@link #indicesComplete()} 之后不可再追加；
 * 类型检查和代码生成都要求下标已完成。</p>
 */
public class ArrayDesignator extends Designator {
    private final List<Expression> indices = new ArrayList<Expression>();
    private boolean finalized;

    public ArrayDesignator(AstContext context, Token token, Symbol symbol) {
        super(context, token, symbol);
    }

    public void addIndex(Expression index) {
        if (finalized) {
            throw new IllegalStateException("indices of '" + symbol.getName() + "' are already complete");
        }
        indices.add(index);
    }

    public void indicesComplete() {
        if (finalized) {
            throw new IllegalStateException("indices of '" + symbol.getName() + "' are already complete");
        }
        finalized = true;
    }

    public boolean isFinalized() {
        return finalized;
    }

    public List<Expression> getIndices() {
        return Collections.unmodifiableList(indices);
    }

    public int getIndexCount() {
        return indices.size();
    }

    public Expression getIndex(int i) {
        return indices.get(i);
    }

    /** 符号的数组类型，指向数组的指针隐式解引用一层；不是数组时返回 null */
    public ArrayType getArrayType() {
        Type t = symbol.getDataType();
        if (t instanceof PointerType) {
            t = ((PointerType) t).getBaseType();
        }
        return t instanceof ArrayType ? (ArrayType) t : null;
    }

    /** 按下标个数逐层剥去数组维度，下标多于维数时为 null */
    @Override
    public Type getType() {
        ArrayType arrayType = getArrayType();
        if (arrayType == null || indices.size() > arrayType.getNDim()) {
            return null;
        }
        Type t = arrayType;
        for (int i = 0; i < indices.size(); i++) {
            t = ((ArrayType) t).getInnerType();
        }
        return t;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayDesignator(this, context);
    }
}
