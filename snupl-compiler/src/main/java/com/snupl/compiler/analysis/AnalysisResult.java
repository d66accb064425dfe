package com.snupl.compiler.analysis;

import com.snupl.compiler.ast.decl.ModuleDecl;

import java.util.Collections;
import java.util.List;

/**
 * 语义分析结果。检查遇错即停，诊断至多一条。
 */
public final class AnalysisResult {
    private final ModuleDecl module;
    private final List<SemanticDiagnostic> diagnostics;

    public AnalysisResult(ModuleDecl module, List<SemanticDiagnostic> diagnostics) {
        this.module = module;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public ModuleDecl getModule() { return module; }
    public List<SemanticDiagnostic> getDiagnostics() { return diagnostics; }

    public boolean isSuccess() {
        return diagnostics.isEmpty();
    }

    /** 第一条诊断，检查通过时为 null */
    public SemanticDiagnostic getFirstError() {
        return diagnostics.isEmpty() ? null : diagnostics.get(0);
    }
}
