package com.snupl.compiler.analysis.types;

/**
 * 类型常量与构造工厂
 */
public final class Types {

    public static final PrimitiveType NULL = new PrimitiveType(PrimitiveType.Kind.NULL);
    public static final PrimitiveType INTEGER = new PrimitiveType(PrimitiveType.Kind.INTEGER);
    public static final PrimitiveType BOOLEAN = new PrimitiveType(PrimitiveType.Kind.BOOLEAN);
    public static final PrimitiveType CHAR = new PrimitiveType(PrimitiveType.Kind.CHAR);

    private Types() {}

    public static PointerType pointerTo(Type base) {
        if (base == null) {
            throw new IllegalArgumentException("pointer base type must not be null");
        }
        return new PointerType(base);
    }

    public static ArrayType arrayOf(int elementCount, Type inner) {
        if (inner == null || inner.isNull()) {
            throw new IllegalArgumentException("array element type must not be null");
        }
        if (elementCount < 0 && elementCount != ArrayType.OPEN) {
            throw new IllegalArgumentException("invalid array size: " + elementCount);
        }
        return new ArrayType(elementCount, inner);
    }

    /** 多维数组，dims 从外到内 */
    public static ArrayType arrayOf(Type base, int... dims) {
        if (dims.length == 0) {
            throw new IllegalArgumentException("at least one dimension required");
        }
        Type t = base;
        for (int i = dims.length - 1; i >= 0; i--) {
            t = arrayOf(dims[i], t);
        }
        return (ArrayType) t;
    }

    public static boolean isInteger(Type t) {
        return t != null && t.match(INTEGER);
    }

    public static boolean isBoolean(Type t) {
        return t != null && t.match(BOOLEAN);
    }

    /** 类型的显示名，null 显示为 {@code <INVALID>} */
    public static String nameOf(Type t) {
        return t != null ? t.toDisplayString() : "<INVALID>";
    }
}
