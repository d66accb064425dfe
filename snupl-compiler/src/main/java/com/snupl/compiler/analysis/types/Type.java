package com.snupl.compiler.analysis.types;

/**
 * SnuPL 类型基类。
 * 类型按结构比较：{@link #match(Type)} 决定赋值、传参与运算的兼容性。
 */
public abstract class Type {

    /** 类型占用的字节数 */
    public abstract int getSize();

    /** 人类可读的类型名，用于诊断消息和转储 */
    public abstract String toDisplayString();

    /** 结构化类型匹配，不做任何隐式转换 */
    public abstract boolean match(Type other);

    public boolean isNull() {
        return false;
    }

    /** 标量类型可以赋值、比较和作为运算数 */
    public boolean isScalar() {
        return false;
    }

    public boolean isPointer() {
        return false;
    }

    public boolean isArray() {
        return false;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
