package org.csu.formula.common.exception;

/**
 * @author hidyouth
 * @description: 静态分析阶段的自定义异常 (公式引用了不存在的变量或函数)
 */
public class SemanticException extends FormulaException {
    public SemanticException(String message) {
        super(ErrorKind.EVALUATION, message);
    }
}
