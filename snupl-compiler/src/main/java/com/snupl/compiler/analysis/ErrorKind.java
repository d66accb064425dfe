package com.snupl.compiler.analysis;

/**
 * 语义错误分类，每个值对应一条类型规则
 */
public enum ErrorKind {
    // 赋值
    INVALID_ASSIGN_TARGET,
    INVALID_ASSIGN_VALUE,
    ASSIGN_TYPE_MISMATCH,

    // 返回
    UNEXPECTED_RETURN_VALUE,
    MISSING_RETURN_VALUE,
    RETURN_TYPE_MISMATCH,

    // if/while
    CONDITION_NOT_BOOLEAN,

    // 运算
    OPERAND_NOT_SCALAR,
    POINTER_OPERAND,
    OPERAND_TYPE_MISMATCH,
    OPERAND_NOT_INTEGER,
    OPERAND_NOT_BOOLEAN,
    BOOLEAN_OPERAND,
    DEREF_NON_POINTER,

    // 调用
    ARGUMENT_COUNT_MISMATCH,
    ARGUMENT_TYPE_MISMATCH,

    // 标识符与数组
    INVALID_DESIGNATOR_TYPE,
    INDEX_NOT_INTEGER,
    INVALID_ARRAY_ACCESS,

    // 字面量
    INVALID_CONSTANT_TYPE,
    INTEGER_OUT_OF_RANGE,
    INVALID_STRING_TYPE
}
