package org.csu.formula.common.exception;

import lombok.Getter;

/**
 * 公式引擎所有错误的基类。
 * 第一个错误即终止整个求值过程，不产生部分结果。
 */
@Getter
public class FormulaException extends RuntimeException {

    private final ErrorKind kind;

    public FormulaException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FormulaException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
