package com.snupl.ir.tac;

/**
 * 三地址码操作数
 */
public abstract class TacAddr {

    @Override
    public abstract String toString();
}
