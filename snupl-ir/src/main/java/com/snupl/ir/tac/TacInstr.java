package com.snupl.ir.tac;

/**
 * 三地址码指令。
 *
 * <p>跳转指令的目标保存在 target 中，其余指令的结果保存在 dest 中；
 * PARAM 的 dest 是参数序号常量。</p>
 */
public class TacInstr {

    private final Opcode op;
    private final TacAddr dest;
    private final TacAddr src1;
    private final TacAddr src2;
    private TacLabel target;

    public TacInstr(Opcode op, TacAddr dest, TacAddr src1, TacAddr src2) {
        if (op.isBranch() || op == Opcode.LABEL) {
            throw new IllegalArgumentException(op + " requires a label");
        }
        this.op = op;
        this.dest = dest;
        this.src1 = src1;
        this.src2 = src2;
    }

    private TacInstr(Opcode op, TacLabel target, TacAddr src1, TacAddr src2) {
        this.op = op;
        this.dest = null;
        this.src1 = src1;
        this.src2 = src2;
        this.target = target;
    }

    /** 标签指令专用 */
    protected TacInstr() {
        this.op = Opcode.LABEL;
        this.dest = null;
        this.src1 = null;
        this.src2 = null;
    }

    /** 无条件跳转 */
    public static TacInstr jump(TacLabel target) {
        return new TacInstr(Opcode.GOTO, target, null, null);
    }

    /** 条件跳转：src1 op src2 成立时转到 target */
    public static TacInstr branch(Opcode relop, TacLabel target, TacAddr src1, TacAddr src2) {
        if (!relop.isRelational()) {
            throw new IllegalArgumentException(relop + " is not a relational operator");
        }
        return new TacInstr(relop, target, src1, src2);
    }

    public Opcode getOp() { return op; }
    public TacAddr getDest() { return dest; }
    public TacAddr getSrc1() { return src1; }
    public TacAddr getSrc2() { return src2; }
    public TacLabel getTarget() { return target; }

    /** 重定向跳转目标（控制流清理使用） */
    public void setTarget(TacLabel target) {
        if (!op.isBranch()) {
            throw new IllegalStateException(op + " has no branch target");
        }
        this.target = target;
    }

    public boolean isBranch() {
        return op.isBranch();
    }

    public boolean isLabel() {
        return op == Opcode.LABEL;
    }

    @Override
    public String toString() {
        switch (op) {
            case GOTO:
                return "goto " + target.getName();
            case ASSIGN:
                return dest + " := " + src1;
            case PARAM:
                return "param " + dest + " <- " + src1;
            case CALL:
                return dest != null ? dest + " := call " + src1 : "call " + src1;
            case RETURN:
                return src1 != null ? "return " + src1 : "return";
            case DIM:
                return dest + " := dim " + src1 + ", " + src2;
            case DOFS:
                return dest + " := dofs " + src1;
            default:
                break;
        }
        if (op.isRelational()) {
            return "if " + src1 + " " + op.toSourceString() + " " + src2 + " goto " + target.getName();
        }
        if (op.isUnary()) {
            return dest + " := " + op.toSourceString() + " " + src1;
        }
        return dest + " := " + src1 + " " + op.toSourceString() + " " + src2;
    }
}
