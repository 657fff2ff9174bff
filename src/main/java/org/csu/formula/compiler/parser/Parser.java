package org.csu.formula.compiler.parser;

import org.csu.formula.common.exception.ParseException;
import org.csu.formula.common.model.Value;
import org.csu.formula.compiler.lexer.Token;
import org.csu.formula.compiler.lexer.TokenType;
import org.csu.formula.compiler.parser.ast.ExpressionNode;
import org.csu.formula.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.formula.compiler.parser.ast.expression.BinaryOperator;
import org.csu.formula.compiler.parser.ast.expression.ComparisonNode;
import org.csu.formula.compiler.parser.ast.expression.ComparisonOperator;
import org.csu.formula.compiler.parser.ast.expression.FunctionCallNode;
import org.csu.formula.compiler.parser.ast.expression.LiteralNode;
import org.csu.formula.compiler.parser.ast.expression.UnaryExpressionNode;
import org.csu.formula.compiler.parser.ast.expression.UnaryOperator;
import org.csu.formula.compiler.parser.ast.expression.VariableNode;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Locale;

/**
 * @author hidyouth
 * @description: 语法分析器
 * 采用优先级爬升 (precedence climbing) 的递归下降法，将Token流转换为抽象语法树(AST)
 *
 * 优先级: ^ (4, 右结合) > * / (3) > + - & (2) > 比较运算符 (1)。
 * 比较运算符在同一个循环中折叠，因此 a=b=c 解析为 (a=b)=c。
 *
 * 深度限制同时作用于两处：递归下降的重入层数（括号嵌套），以及生成的 AST 高度。
 * 左结合链 1+1+...+1 只重入一层，但生成的树高度等于操作数个数，求值器和分析器都按树高递归。
 */
public class Parser {

    public static final int DEFAULT_MAX_DEPTH = 256;

    private final List<Token> tokens;
    private final int maxDepth;
    private int position = 0;
    private int depth = 0;
    // 叶子节点不登记，高度视为 1
    private final Map<ExpressionNode, Integer> heights = new IdentityHashMap<>();

    public Parser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_DEPTH);
    }

    public Parser(List<Token> tokens, int maxDepth) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token stream must be terminated by EOF");
        }
        this.tokens = tokens;
        this.maxDepth = maxDepth;
    }

    /**
     * 解析整个 Token 流，必须恰好消耗到 EOF。
     */
    public ExpressionNode parse() {
        ExpressionNode expression = parseExpression(0);
        consume(TokenType.EOF, "end of formula");
        return expression;
    }

    private ExpressionNode parseExpression(int minPrecedence) {
        enter();
        try {
            ExpressionNode node = parsePrefix();
            while (true) {
                Token token = peek();
                if (token.type() == TokenType.OPERATOR) {
                    BinaryOperator operator = BinaryOperator.fromSymbol(token.lexeme());
                    if (operator.precedence() < minPrecedence) {
                        break;
                    }
                    advance();
                    int nextMin = operator.precedence() + (operator.isRightAssociative() ? 0 : 1);
                    ExpressionNode right = parseExpression(nextMin);
                    node = track(new BinaryExpressionNode(node, operator, right), node, right);
                    continue;
                }
                if (token.type() == TokenType.COMPARATOR) {
                    if (ComparisonOperator.PRECEDENCE < minPrecedence) {
                        break;
                    }
                    ComparisonOperator operator = ComparisonOperator.fromSymbol(advance().lexeme());
                    ExpressionNode right = parseExpression(ComparisonOperator.PRECEDENCE + 1);
                    node = track(new ComparisonNode(node, operator, right), node, right);
                    continue;
                }
                break;
            }
            return node;
        } finally {
            depth--;
        }
    }

    private ExpressionNode parsePrefix() {
        Token token = advance();
        switch (token.type()) {
            case NUMBER:
                return new LiteralNode(token.literal() instanceof Long l ? Value.of(l.longValue()) : Value.of((Double) token.literal()));
            case STRING:
                return new LiteralNode(Value.text((String) token.literal()));
            case BOOLEAN:
                return new LiteralNode(Value.of((Boolean) token.literal()));
            case NULL:
                return new LiteralNode(Value.NULL);
            case VARIABLE:
                return new VariableNode((String) token.literal());
            case OPERATOR:
                if (token.is(TokenType.OPERATOR, "+") || token.is(TokenType.OPERATOR, "-")) {
                    ExpressionNode operand = parseExpression(BinaryOperator.POWER.precedence());
                    return track(new UnaryExpressionNode(UnaryOperator.fromSymbol(token.lexeme()), operand), operand);
                }
                throw new ParseException(token, "an expression");
            case LPAREN: {
                ExpressionNode expression = parseExpression(0);
                consume(TokenType.RPAREN, "')' after expression");
                return expression;
            }
            case IDENTIFIER:
                if (check(TokenType.LPAREN)) {
                    advance();
                    List<ExpressionNode> arguments = parseArguments();
                    return track(new FunctionCallNode(token.lexeme().toUpperCase(Locale.ROOT), arguments),
                            arguments.toArray(new ExpressionNode[0]));
                }
                throw new ParseException("Unexpected identifier '" + token.lexeme() + "' at position "
                        + token.position() + ". Variables must use {{name}} notation.");
            default:
                throw new ParseException(token, "an expression (a literal, a {{variable}} or a function call)");
        }
    }

    private List<ExpressionNode> parseArguments() {
        List<ExpressionNode> arguments = new ArrayList<>();
        if (match(TokenType.RPAREN)) {
            return arguments;
        }
        while (true) {
            arguments.add(parseExpression(0));
            if (match(TokenType.ARG_SEPARATOR)) {
                continue;
            }
            if (match(TokenType.RPAREN)) {
                break;
            }
            throw new ParseException(peek(), "';' or ')' in function arguments");
        }
        return arguments;
    }

    private void enter() {
        if (++depth > maxDepth) {
            throw new ParseException("Formula nesting exceeds the maximum depth of " + maxDepth);
        }
    }

    /**
     * 登记新节点的高度 (1 + 子节点最大高度)，超过上限立即报错。
     */
    private <T extends ExpressionNode> T track(T node, ExpressionNode... children) {
        int height = 1;
        for (ExpressionNode child : children) {
            height = Math.max(height, heights.getOrDefault(child, 1) + 1);
        }
        if (height > maxDepth) {
            throw new ParseException("Formula nesting exceeds the maximum depth of " + maxDepth);
        }
        heights.put(node, height);
        return node;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw new ParseException(peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        Token token = peek();
        if (token.type() != TokenType.EOF) position++;
        return token;
    }

    private Token peek() {
        return tokens.get(position);
    }
}
