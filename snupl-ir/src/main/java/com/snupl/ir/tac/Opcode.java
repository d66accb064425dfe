package com.snupl.ir.tac;

/**
 * 三地址码操作码（封闭集合）
 */
public enum Opcode {
    // 二元算术/逻辑
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    AND("&&"),
    OR("||"),

    // 条件跳转：if src1 op src2 goto target
    EQUAL("="),
    NOT_EQUAL("#"),
    LESS_THAN("<"),
    LESS_EQUAL("<="),
    BIGGER_THAN(">"),
    BIGGER_EQUAL(">="),

    // 一元
    NEG("neg"),
    POS("pos"),
    NOT("not"),
    ADDRESS("&()"),
    DEREF("*()"),
    CAST("cast"),

    // 数据移动与调用
    ASSIGN(":="),
    PARAM("param"),
    CALL("call"),
    RETURN("return"),

    // 控制流
    GOTO("goto"),
    LABEL("label"),

    // 数组描述符查询：dim（第 n 维元素数，n 从 1 开始）与 dofs（数据偏移）
    DIM("dim"),
    DOFS("dofs");

    private final String source;

    Opcode(String source) {
        this.source = source;
    }

    public String toSourceString() {
        return source;
    }

    public boolean isRelational() {
        return this == EQUAL || this == NOT_EQUAL || this == LESS_THAN
                || this == LESS_EQUAL || this == BIGGER_THAN || this == BIGGER_EQUAL;
    }

    public boolean isBinary() {
        return this == ADD || this == SUB || this == MUL || this == DIV || this == AND || this == OR;
    }

    public boolean isUnary() {
        return this == NEG || this == POS || this == NOT || this == ADDRESS || this == DEREF || this == CAST;
    }

    /** 带跳转目标的指令 */
    public boolean isBranch() {
        return this == GOTO || isRelational();
    }
}
