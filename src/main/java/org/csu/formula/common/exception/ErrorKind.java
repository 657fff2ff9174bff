package org.csu.formula.common.exception;

/**
 * 公式错误的分类。
 */
public enum ErrorKind {
    LEXICAL,    // 词法错误: 非法字符, 未闭合的字符串/占位符
    SYNTAX,     // 语法错误: 意外的 Token, 缺少括号, 裸标识符
    EVALUATION  // 求值错误: 未知变量/函数, 除零, 类型转换失败, 函数参数校验
}
