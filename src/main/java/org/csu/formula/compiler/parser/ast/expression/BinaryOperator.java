package org.csu.formula.compiler.parser.ast.expression;

/**
 * 二元运算符及其优先级。^ 为右结合，其余为左结合。
 */
public enum BinaryOperator {
    POWER("^", 4, true),
    MULTIPLY("*", 3, false),
    DIVIDE("/", 3, false),
    ADD("+", 2, false),
    SUBTRACT("-", 2, false),
    CONCAT("&", 2, false);

    private final String symbol;
    private final int precedence;
    private final boolean rightAssociative;

    BinaryOperator(String symbol, int precedence, boolean rightAssociative) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.rightAssociative = rightAssociative;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isRightAssociative() {
        return rightAssociative;
    }

    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Not a binary operator: " + symbol);
    }
}
