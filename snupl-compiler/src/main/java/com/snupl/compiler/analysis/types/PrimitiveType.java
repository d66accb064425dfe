package com.snupl.compiler.analysis.types;

/**
 * 基本类型：null（无值）、integer、boolean、char
 */
public final class PrimitiveType extends Type {

    public enum Kind {
        NULL("NULL", 0),
        INTEGER("integer", 4),
        BOOLEAN("boolean", 1),
        CHAR("char", 1);

        private final String displayName;
        private final int size;

        Kind(String displayName, int size) {
            this.displayName = displayName;
            this.size = size;
        }
    }

    private final Kind kind;

    PrimitiveType(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public int getSize() {
        return kind.size;
    }

    @Override
    public String toDisplayString() {
        return kind.displayName;
    }

    @Override
    public boolean match(Type other) {
        return other instanceof PrimitiveType && ((PrimitiveType) other).kind == kind;
    }

    @Override
    public boolean isNull() {
        return kind == Kind.NULL;
    }

    @Override
    public boolean isScalar() {
        return kind != Kind.NULL;
    }
}
