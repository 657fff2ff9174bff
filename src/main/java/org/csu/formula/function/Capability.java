package org.csu.formula.function;

/**
 * 函数声明的额外能力，决定调用时 {@link FunctionInvocation} 能提供哪些对象。
 */
public enum Capability {
    /** 可以读取本次求值的变量上下文 */
    CONTEXT,
    /** 可以读取函数注册表 */
    REGISTRY
}
