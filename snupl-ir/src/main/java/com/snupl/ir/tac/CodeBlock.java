package com.snupl.ir.tac;

import com.snupl.compiler.analysis.Symbol;
import com.snupl.compiler.analysis.SymbolTable;
import com.snupl.compiler.analysis.types.Type;
import com.snupl.compiler.ast.decl.AstScope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个作用域的线性三地址码。
 * 标签与临时变量的编号在块内单调递增。
 */
public class CodeBlock {

    private final AstScope owner;
    private final List<TacInstr> instructions = new ArrayList<TacInstr>();
    private int labelCounter = 0;
    private int tempCounter = 0;

    public CodeBlock(AstScope owner) {
        this.owner = owner;
    }

    public AstScope getOwner() {
        return owner;
    }

    public SymbolTable getSymbolTable() {
        return owner.getSymbolTable();
    }

    // ========== 标签与临时变量 ==========

    public TacLabel createLabel() {
        return new TacLabel(Integer.toString(labelCounter++));
    }

    /** 标签名为 {@code <n>_<hint>} */
    public TacLabel createLabel(String hint) {
        if (hint == null || hint.isEmpty()) {
            return createLabel();
        }
        return new TacLabel(labelCounter++ + "_" + hint);
    }

    /**
     * 分配临时变量 {@code $t<n>}，通过所属作用域创建符号并登记到其符号表
     */
    public TacTemp createTemp(Type type) {
        SymbolTable table = owner.getSymbolTable();
        Symbol symbol = owner.createVar("$t" + tempCounter++, type);
        while (!table.define(symbol)) {
            symbol = owner.createVar("$t" + tempCounter++, type);
        }
        return new TacTemp(symbol);
    }

    // ========== 指令序列 ==========

    public void addInstr(TacInstr instr) {
        instructions.add(instr);
    }

    public List<TacInstr> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }

    /** 整体替换指令序列（供优化 pass 使用） */
    public void setInstructions(List<TacInstr> newInstructions) {
        List<TacInstr> copy = new ArrayList<TacInstr>(newInstructions);
        instructions.clear();
        instructions.addAll(copy);
    }

    public int size() {
        return instructions.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (TacInstr instr : instructions) {
            if (!instr.isLabel()) {
                sb.append("    ");
            }
            sb.append(instr).append('\n');
        }
        return sb.toString();
    }
}
