package org.csu.formula.common.exception;

import org.csu.formula.compiler.lexer.Token;

/**
 * 语法分析阶段的异常。
 */
public class ParseException extends FormulaException {

    public ParseException(String message) {
        super(ErrorKind.SYNTAX, message);
    }

    public ParseException(Token token, String expected) {
        super(ErrorKind.SYNTAX, String.format("Syntax Error at position %d: Expected %s, but found '%s' (%s)",
                token.position(),
                expected,
                token.lexeme(),
                token.type()));
    }
}
