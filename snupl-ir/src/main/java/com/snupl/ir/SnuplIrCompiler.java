package com.snupl.ir;

import com.snupl.compiler.analysis.AnalysisResult;
import com.snupl.compiler.analysis.SemanticException;
import com.snupl.compiler.analysis.TypeChecker;
import com.snupl.compiler.ast.decl.ModuleDecl;
import com.snupl.ir.pass.PassPipeline;
import com.snupl.ir.tac.TacModule;

/**
 * 三地址码编译器门面。
 * 管线：AST → 类型检查 → 三地址码 → 控制流清理。
 */
public class SnuplIrCompiler {

    private final PassPipeline pipeline;

    public SnuplIrCompiler() {
        this(new IrOptions());
    }

    public SnuplIrCompiler(IrOptions options) {
        this.pipeline = PassPipeline.create(options);
    }

    public SnuplIrCompiler(PassPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * 只做类型检查。
     */
    public AnalysisResult check(ModuleDecl module) {
        return TypeChecker.analyze(module);
    }

    /**
     * 类型检查并生成三地址码。
     *
     * @throws SemanticException 第一个类型错误
     */
    public TacModule compile(ModuleDecl module) {
        new TypeChecker().check(module);
        return pipeline.execute(module);
    }
}
