package com.snupl.ir.pass;

import com.snupl.ir.tac.TacModule;

/**
 * 三地址码 pass 接口。
 */
public interface TacPass {

    /**
     * Pass 名称。
     */
    String getName();

    /**
     * 对三地址码模块执行变换。
     */
    TacModule run(TacModule module);
}
