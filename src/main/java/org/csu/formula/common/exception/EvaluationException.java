package org.csu.formula.common.exception;

/**
 * 求值阶段的异常: 未知变量、未知函数、除零、类型转换失败以及函数自身的参数校验。
 */
public class EvaluationException extends FormulaException {

    public EvaluationException(String message) {
        super(ErrorKind.EVALUATION, message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(ErrorKind.EVALUATION, message, cause);
    }
}
