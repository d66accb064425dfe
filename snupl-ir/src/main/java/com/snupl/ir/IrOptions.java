package com.snupl.ir;

/**
 * 中间代码生成选项
 */
public class IrOptions {
    private boolean cleanupControlFlow = true;
    private boolean dumpTac = "1".equals(System.getenv("SNUPL_DUMP_TAC"));

    public IrOptions() {
    }

    public boolean isCleanupControlFlow() {
        return cleanupControlFlow;
    }

    /** 关闭后保留未清理的原始降级结果 */
    public void setCleanupControlFlow(boolean cleanupControlFlow) {
        this.cleanupControlFlow = cleanupControlFlow;
    }

    public boolean isDumpTac() {
        return dumpTac;
    }

    public void setDumpTac(boolean dumpTac) {
        this.dumpTac = dumpTac;
    }
}
