package com.snupl.compiler.analysis.types;

/**
 * 数组类型 T[n]。多维数组是数组的数组，{@code integer[3][4]} 的外层元素数为 3。
 *
 * <p>运行时内存布局：4 字节维数，每维 4 字节元素数，其后是数据。
 * 开放维度（{@link #OPEN}）只出现在参数类型中，与任意元素数匹配。</p>
 */
public final class ArrayType extends Type {

    public static final int OPEN = -1;

    private final int elementCount;
    private final Type innerType;

    ArrayType(int elementCount, Type innerType) {
        this.elementCount = elementCount;
        this.innerType = innerType;
    }

    public int getElementCount() {
        return elementCount;
    }

    public boolean isOpen() {
        return elementCount == OPEN;
    }

    /** 去掉一维后的类型 */
    public Type getInnerType() {
        return innerType;
    }

    /** 最内层元素类型 */
    public Type getBaseType() {
        return innerType instanceof ArrayType ? ((ArrayType) innerType).getBaseType() : innerType;
    }

    public int getNDim() {
        return innerType instanceof ArrayType ? ((ArrayType) innerType).getNDim() + 1 : 1;
    }

    /** 数据相对数组起始地址的偏移：维数字段加每维的元素数字段 */
    public int getDataOffset() {
        return 4 + 4 * getNDim();
    }

    @Override
    public int getSize() {
        int count = 1;
        Type t = this;
        while (t instanceof ArrayType) {
            ArrayType at = (ArrayType) t;
            if (at.isOpen()) return getDataOffset();
            count *= at.elementCount;
            t = at.innerType;
        }
        return getDataOffset() + count * t.getSize();
    }

    @Override
    public String toDisplayString() {
        StringBuilder dims = new StringBuilder();
        Type t = this;
        while (t instanceof ArrayType) {
            ArrayType at = (ArrayType) t;
            dims.append('[');
            if (!at.isOpen()) dims.append(at.elementCount);
            dims.append(']');
            t = at.innerType;
        }
        return t.toDisplayString() + dims;
    }

    @Override
    public boolean match(Type other) {
        if (!(other instanceof ArrayType)) return false;
        ArrayType o = (ArrayType) other;
        if (!isOpen() && !o.isOpen() && elementCount != o.elementCount) return false;
        return innerType.match(o.innerType);
    }

    @Override
    public boolean isArray() {
        return true;
    }
}
