package com.snupl.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    GLOBAL,     // 模块级变量，包括合成的字符串常量
    LOCAL,      // 过程局部变量与临时变量
    PARAMETER,  // 过程参数
    PROCEDURE,  // 过程/函数
    CONSTANT    // 具名常量
}
