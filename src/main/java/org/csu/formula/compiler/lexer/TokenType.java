package org.csu.formula.compiler.lexer;

/**
 * @author hidyouth
 * @description: 定义词法单元（Token）的类型，即"种别码"
 *
 * 公式语言中所有可能出现的"单词"的分类。
 */
public enum TokenType {
    // ---- 常量 (Constants) ----
    NUMBER,         // 123, -4.5, 1e3
    STRING,         // "hello"
    BOOLEAN,        // TRUE / FALSE
    NULL,           // NULL / NONE

    // ---- 引用 ----
    VARIABLE,       // {{name}}
    IDENTIFIER,     // 函数名

    // ---- 运算符 (Operators) ----
    OPERATOR,       // + - * / ^ &
    COMPARATOR,     // = <> > >= < <=

    // ---- 分隔符 (Delimiters) ----
    LPAREN,         // (
    RPAREN,         // )
    ARG_SEPARATOR,  // ; 或 ,

    // ---- 特殊 Token ----
    EOF             // 输入流结束
}
