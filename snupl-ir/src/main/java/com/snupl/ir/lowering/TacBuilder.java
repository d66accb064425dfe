package com.snupl.ir.lowering;

import com.snupl.compiler.analysis.ProcedureSymbol;
import com.snupl.compiler.analysis.types.Type;
import com.snupl.ir.tac.CodeBlock;
import com.snupl.ir.tac.Opcode;
import com.snupl.ir.tac.TacAddr;
import com.snupl.ir.tac.TacConst;
import com.snupl.ir.tac.TacInstr;
import com.snupl.ir.tac.TacLabel;
import com.snupl.ir.tac.TacName;
import com.snupl.ir.tac.TacTemp;

/**
 * 三地址码构建辅助类。
 * 封装创建指令、标签、临时变量的便捷方法。
 */
public class TacBuilder {

    private final CodeBlock block;

    public TacBuilder(CodeBlock block) {
        this.block = block;
    }

    // ========== 标签与临时变量 ==========

    public TacLabel newLabel() {
        return block.createLabel();
    }

    public TacLabel newLabel(String hint) {
        return block.createLabel(hint);
    }

    public TacTemp newTemp(Type type) {
        return block.createTemp(type);
    }

    /** 放置标签 */
    public void place(TacLabel label) {
        block.addInstr(label);
    }

    // ========== 指令发射 ==========

    public void emit(TacInstr instr) {
        block.addInstr(instr);
    }

    public void emitGoto(TacLabel target) {
        emit(TacInstr.jump(target));
    }

    public void emitBranch(Opcode relop, TacLabel target, TacAddr left, TacAddr right) {
        emit(TacInstr.branch(relop, target, left, right));
    }

    public void emitAssign(TacAddr dest, TacAddr src) {
        emit(new TacInstr(Opcode.ASSIGN, dest, src, null));
    }

    /** 二元运算，结果写入新的临时变量 */
    public TacTemp emitBinary(Opcode op, Type resultType, TacAddr left, TacAddr right) {
        TacTemp dest = newTemp(resultType);
        emit(new TacInstr(op, dest, left, right));
        return dest;
    }

    /** 一元运算，结果写入新的临时变量 */
    public TacTemp emitUnary(Opcode op, Type resultType, TacAddr src) {
        TacTemp dest = newTemp(resultType);
        emit(new TacInstr(op, dest, src, null));
        return dest;
    }

    public void emitParam(int index, TacAddr value) {
        emit(new TacInstr(Opcode.PARAM, new TacConst(index), value, null));
    }

    /**
     * 调用过程，只有返回类型非空时才分配结果临时变量
     *
     * @return 结果临时变量，过程调用返回 null
     */
    public TacTemp emitCall(ProcedureSymbol proc) {
        TacTemp dest = proc.isFunction() ? newTemp(proc.getReturnType()) : null;
        emit(new TacInstr(Opcode.CALL, dest, new TacName(proc), null));
        return dest;
    }

    public void emitReturn(TacAddr value) {
        emit(new TacInstr(Opcode.RETURN, null, value, null));
    }

    /** 第 dimension 维（从 1 开始）的元素数 */
    public TacTemp emitDim(Type resultType, TacAddr array, int dimension) {
        TacTemp dest = newTemp(resultType);
        emit(new TacInstr(Opcode.DIM, dest, array, new TacConst(dimension)));
        return dest;
    }

    /** 数组数据相对起始地址的偏移 */
    public TacTemp emitDofs(Type resultType, TacAddr array) {
        TacTemp dest = newTemp(resultType);
        emit(new TacInstr(Opcode.DOFS, dest, array, null));
        return dest;
    }
}
