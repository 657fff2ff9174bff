package org.csu.formula.compiler.lexer;

/**
 * @param type     词法单元的类型 (种别码)
 * @param lexeme   词法单元的原始文本 (词素值)
 * @param literal  解码后的值: NUMBER 为 Long/Double, STRING 为去掉转义后的文本,
 *                 BOOLEAN 为 Boolean, VARIABLE 为去掉空白的变量名, 其余为 null
 * @param position 在公式文本中的起始偏移 (从 0 开始)
 */
public record Token(TokenType type, String lexeme, Object literal, int position) {

    public boolean is(TokenType expected, String text) {
        return type == expected && lexeme.equals(text);
    }

    @Override
    public String toString() {
        return String.format("Token[Type=%-13s, Lexeme='%s', Position=%d]", type, lexeme, position);
    }
}
