package com.snupl.ir.pass;

import com.snupl.ir.tac.CodeBlock;
import com.snupl.ir.tac.Opcode;
import com.snupl.ir.tac.TacInstr;
import com.snupl.ir.tac.TacLabel;
import com.snupl.ir.tac.TacModule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 控制流清理：
 * <ul>
 *   <li>相邻标签合并，跳转改指向第一个标签</li>
 *   <li>删除跳到紧随其后标签的 goto</li>
 *   <li>删除没有任何跳转引用的标签</li>
 * </ul>
 * 反复执行直到不再变化，因此重复运行结果不变。
 */
public class ControlFlowCleanup implements TacPass {

    @Override
    public String getName() {
        return "ControlFlowCleanup";
    }

    @Override
    public TacModule run(TacModule module) {
        for (CodeBlock cb : module.getCodeBlocks()) {
            cleanup(cb);
        }
        return module;
    }

    public void cleanup(CodeBlock cb) {
        List<TacInstr> instrs = new ArrayList<TacInstr>(cb.getInstructions());
        boolean changed;
        do {
            changed = coalesceLabels(instrs);
            changed |= removeJumpsToNext(instrs);
            changed |= removeUnreferencedLabels(instrs);
        } while (changed);
        cb.setInstructions(instrs);
    }

    private boolean coalesceLabels(List<TacInstr> instrs) {
        boolean changed = false;
        int i = 0;
        while (i + 1 < instrs.size()) {
            TacInstr first = instrs.get(i);
            TacInstr second = instrs.get(i + 1);
            if (first.isLabel() && second.isLabel()) {
                retarget(instrs, (TacLabel) second, (TacLabel) first);
                instrs.remove(i + 1);
                changed = true;
            } else {
                i++;
            }
        }
        return changed;
    }

    private void retarget(List<TacInstr> instrs, TacLabel from, TacLabel to) {
        for (TacInstr instr : instrs) {
            if (instr.isBranch() && instr.getTarget() == from) {
                instr.setTarget(to);
            }
        }
    }

    private boolean removeJumpsToNext(List<TacInstr> instrs) {
        boolean changed = false;
        int i = 0;
        while (i + 1 < instrs.size()) {
            TacInstr instr = instrs.get(i);
            if (instr.getOp() == Opcode.GOTO && instr.getTarget() == instrs.get(i + 1)) {
                instrs.remove(i);
                changed = true;
            } else {
                i++;
            }
        }
        return changed;
    }

    private boolean removeUnreferencedLabels(List<TacInstr> instrs) {
        Set<TacLabel> referenced = Collections.newSetFromMap(new IdentityHashMap<TacLabel, Boolean>());
        for (TacInstr instr : instrs) {
            if (instr.isBranch()) {
                referenced.add(instr.getTarget());
            }
        }
        boolean changed = false;
        for (int i = instrs.size() - 1; i >= 0; i--) {
            TacInstr instr = instrs.get(i);
            if (instr.isLabel() && !referenced.contains(instr)) {
                instrs.remove(i);
                changed = true;
            }
        }
        return changed;
    }
}
