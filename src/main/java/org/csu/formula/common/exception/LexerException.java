package org.csu.formula.common.exception;

/**
 * 词法分析阶段的异常。
 */
public class LexerException extends FormulaException {

    public LexerException(String message) {
        super(ErrorKind.LEXICAL, message);
    }

    public LexerException(String message, int position) {
        super(ErrorKind.LEXICAL, String.format("%s at position %d", message, position));
    }
}
