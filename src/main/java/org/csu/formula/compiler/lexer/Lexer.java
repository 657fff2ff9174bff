package org.csu.formula.compiler.lexer;

import org.csu.formula.common.exception.LexerException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将公式字符串分解为一系列的Token，以 EOF 结尾。
 */
public class Lexer {

    private static final Pattern NUMBER = Pattern.compile("[+-]?((\\d+\\.\\d*)|(\\d*\\.\\d+)|(\\d+))([eE][+-]?\\d+)?");

    private static final Map<String, Character> ESCAPES = Map.of(
            "n", '\n',
            "t", '\t',
            "r", '\r',
            "\"", '"',
            "\\", '\\'
    );

    private final String input;
    private int position = 0; // 当前读取的位置
    private final List<Token> tokens = new ArrayList<>();

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表, 最后一个为 EOF
     */
    public List<Token> tokenize() {
        tokens.clear();
        position = 0;
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return List.copyOf(tokens);
    }

    private Token nextToken() {
        skipWhitespace();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", null, position);
        }

        char currentChar = peek();

        if (currentChar == '{' && peekNext() == '{') {
            return readVariable();
        }
        if (currentChar == '"') {
            return readString();
        }
        if (startsNumber(currentChar)) {
            return readNumber();
        }
        if (isLetter(currentChar)) {
            return readIdentifierOrKeyword();
        }

        switch (currentChar) {
            case '(':
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")");
            case ';':
            case ',':
                return consumeAndReturn(TokenType.ARG_SEPARATOR, String.valueOf(currentChar));
            case '&':
            case '+':
            case '-':
            case '*':
            case '/':
            case '^':
                return consumeAndReturn(TokenType.OPERATOR, String.valueOf(currentChar));
            case '>':
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.COMPARATOR, ">=");
                }
                return consumeAndReturn(TokenType.COMPARATOR, ">");
            case '<':
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.COMPARATOR, "<=");
                }
                if (peekNext() == '>') {
                    return consumeAndReturn(TokenType.COMPARATOR, "<>");
                }
                return consumeAndReturn(TokenType.COMPARATOR, "<");
            case '=':
                return consumeAndReturn(TokenType.COMPARATOR, "=");
            default:
                throw new LexerException("Unexpected character '" + currentChar + "'", position);
        }
    }

    private Token readVariable() {
        int start = position;
        int end = input.indexOf("}}", position + 2);
        if (end == -1) {
            throw new LexerException("Unterminated variable placeholder", start);
        }
        String name = input.substring(position + 2, end).trim();
        if (name.isEmpty()) {
            throw new LexerException("Empty variable placeholder", start);
        }
        position = end + 2;
        return new Token(TokenType.VARIABLE, input.substring(start, position), name, start);
    }

    private Token readString() {
        int start = position;
        advance(); // 跳过起始的双引号
        StringBuilder buffer = new StringBuilder();
        while (position < input.length()) {
            char ch = peek();
            if (ch == '"') {
                if (peekNext() == '"') {
                    // "" 表示字面量双引号
                    buffer.append('"');
                    position += 2;
                    continue;
                }
                advance(); // 跳过结束的双引号
                return new Token(TokenType.STRING, input.substring(start, position), buffer.toString(), start);
            }
            if (ch == '\\') {
                advance();
                if (position >= input.length()) {
                    throw new LexerException("Invalid escape sequence in string literal", position - 1);
                }
                String escaped = String.valueOf(peek());
                Character replacement = ESCAPES.get(escaped);
                buffer.append(replacement != null ? replacement : peek());
                advance();
                continue;
            }
            buffer.append(ch);
            advance();
        }
        throw new LexerException("Unterminated string literal", start);
    }

    private Token readNumber() {
        int start = position;
        Matcher matcher = NUMBER.matcher(input);
        if (!matcher.find(position) || matcher.start() != position) {
            throw new LexerException("Invalid number", position);
        }
        String number = matcher.group();
        position = matcher.end();
        Object literal;
        if (number.indexOf('.') >= 0 || number.indexOf('e') >= 0 || number.indexOf('E') >= 0) {
            literal = Double.parseDouble(number);
        } else {
            try {
                literal = Long.parseLong(number);
            } catch (NumberFormatException e) {
                // 超出 long 范围的整数退化为浮点数
                literal = Double.parseDouble(number);
            }
        }
        return new Token(TokenType.NUMBER, number, literal, start);
    }

    private Token readIdentifierOrKeyword() {
        int start = position;
        advance();
        while (position < input.length() && isIdentifierPart(peek())) {
            advance();
        }
        String text = input.substring(start, position);
        // 关键字忽略大小写
        switch (text.toUpperCase(Locale.ROOT)) {
            case "TRUE":
                return new Token(TokenType.BOOLEAN, text, Boolean.TRUE, start);
            case "FALSE":
                return new Token(TokenType.BOOLEAN, text, Boolean.FALSE, start);
            case "NULL":
            case "NONE":
                return new Token(TokenType.NULL, text, null, start);
            default:
                return new Token(TokenType.IDENTIFIER, text, null, start);
        }
    }

    private boolean startsNumber(char c) {
        if (isDigit(c) || (c == '.' && isDigit(peekNext()))) {
            return true;
        }
        if (!isSign(c) || !operandMayStart()) {
            return false;
        }
        char next = peekNext();
        return isDigit(next) || (next == '.' && position + 2 < input.length() && isDigit(input.charAt(position + 2)));
    }

    /**
     * 符号只有在操作数可以出现的位置才并入数字，否则 "1-2" 会被切成 1 和 -2。
     */
    private boolean operandMayStart() {
        if (tokens.isEmpty()) {
            return true;
        }
        TokenType last = tokens.get(tokens.size() - 1).type();
        return last == TokenType.OPERATOR
                || last == TokenType.COMPARATOR
                || last == TokenType.LPAREN
                || last == TokenType.ARG_SEPARATOR;
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0';
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        position++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, null, position);
        position += lexeme.length();
        return token;
    }

    private boolean isLetter(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isSign(char c) {
        return c == '+' || c == '-';
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }
}
