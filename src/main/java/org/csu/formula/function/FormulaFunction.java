package org.csu.formula.function;

import org.csu.formula.common.model.Value;

/**
 * 所有公式函数统一的调用签名。参数已经全部求值完毕。
 * 返回 null 等同于 {@link Value#NULL}。
 */
@FunctionalInterface
public interface FormulaFunction {
    Value apply(FunctionInvocation invocation);
}
