package com.snupl.ir.tac;

import com.snupl.compiler.ast.AstNode;
import com.snupl.compiler.ast.decl.AstScope;
import com.snupl.compiler.ast.decl.ModuleDecl;
import com.snupl.compiler.ast.decl.ProcedureDecl;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个编译单元的三地址码：每个作用域一个代码块（按首次创建顺序），
 * 以及每个表达式节点在值模式下生成的操作数。
 */
public class TacModule {

    private final ModuleDecl module;
    private final Map<AstScope, CodeBlock> codeBlocks = new LinkedHashMap<AstScope, CodeBlock>();
    private final Map<AstNode, TacAddr> operands = new IdentityHashMap<AstNode, TacAddr>();

    public TacModule(ModuleDecl module) {
        this.module = module;
    }

    public ModuleDecl getModule() {
        return module;
    }

    /** 获取作用域的代码块，首次访问时创建 */
    public CodeBlock getCodeBlock(AstScope scope) {
        CodeBlock cb = codeBlocks.get(scope);
        if (cb == null) {
            cb = new CodeBlock(scope);
            codeBlocks.put(scope, cb);
        }
        return cb;
    }

    public List<CodeBlock> getCodeBlocks() {
        return new ArrayList<CodeBlock>(codeBlocks.values());
    }

    /** 按名字查找作用域的代码块，找不到返回 null */
    public CodeBlock findCodeBlock(String scopeName) {
        for (CodeBlock cb : codeBlocks.values()) {
            if (cb.getOwner().getName().equals(scopeName)) {
                return cb;
            }
        }
        return null;
    }

    /** 节点在值模式下生成的操作数，未生成时返回 null */
    public TacAddr getOperand(AstNode node) {
        return operands.get(node);
    }

    public void setOperand(AstNode node, TacAddr operand) {
        operands.put(node, operand);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (CodeBlock cb : codeBlocks.values()) {
            AstScope scope = cb.getOwner();
            sb.append(scope instanceof ProcedureDecl ? "procedure " : "module ")
                    .append(scope.getName()).append(":\n");
            sb.append(cb);
            sb.append('\n');
        }
        return sb.toString();
    }
}
