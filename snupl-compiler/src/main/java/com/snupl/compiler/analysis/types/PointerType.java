package com.snupl.compiler.analysis.types;

/**
 * 指针类型 ^T。
 * 基类型为 null 的指针与任意指针匹配。
 */
public final class PointerType extends Type {
    private final Type baseType;

    PointerType(Type baseType) {
        this.baseType = baseType;
    }

    public Type getBaseType() {
        return baseType;
    }

    @Override
    public int getSize() {
        return 8;
    }

    @Override
    public String toDisplayString() {
        return "^" + baseType.toDisplayString();
    }

    @Override
    public boolean match(Type other) {
        if (!(other instanceof PointerType)) return false;
        Type otherBase = ((PointerType) other).baseType;
        if (baseType.isNull() || otherBase.isNull()) return true;
        return baseType.match(otherBase);
    }

    @Override
    public boolean isScalar() {
        return true;
    }

    @Override
    public boolean isPointer() {
        return true;
    }
}
