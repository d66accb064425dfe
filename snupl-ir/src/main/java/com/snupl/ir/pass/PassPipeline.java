package com.snupl.ir.pass;

import com.snupl.compiler.ast.decl.ModuleDecl;
import com.snupl.ir.IrOptions;
import com.snupl.ir.lowering.AstToTacLowering;
import com.snupl.ir.tac.TacModule;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译 Pass 管线。
 * 串联流程：AST → 三地址码 → 三地址码 pass。
 */
public class PassPipeline {

    private final List<TacPass> passes = new ArrayList<TacPass>();
    private boolean dumpTac = false;
    private PrintStream dumpOut = System.err;

    public PassPipeline() {
    }

    /**
     * 创建默认管线（包含控制流清理）。
     */
    public static PassPipeline createDefault() {
        return create(new IrOptions());
    }

    public static PassPipeline create(IrOptions options) {
        PassPipeline pipeline = new PassPipeline();
        if (options.isCleanupControlFlow()) {
            pipeline.addPass(new ControlFlowCleanup());
        }
        pipeline.setDumpTac(options.isDumpTac());
        return pipeline;
    }

    public void addPass(TacPass pass) {
        passes.add(pass);
    }

    public List<TacPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    public void setDumpTac(boolean dumpTac) {
        this.dumpTac = dumpTac;
    }

    public void setDumpOut(PrintStream dumpOut) {
        this.dumpOut = dumpOut;
    }

    /**
     * 执行管线。模块必须已通过类型检查。
     */
    public TacModule execute(ModuleDecl module) {
        TacModule tac = new AstToTacLowering().lower(module);
        for (TacPass pass : passes) {
            tac = pass.run(tac);
        }

        // TAC dump（设置 SNUPL_DUMP_TAC=1 环境变量启用）
        if (dumpTac) {
            dumpOut.println("===== TAC DUMP =====");
            dumpOut.print(tac);
            dumpOut.println("===== END TAC DUMP =====");
        }
        return tac;
    }
}
