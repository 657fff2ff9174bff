package org.csu.formula.compiler.parser.ast.expression;

import org.csu.formula.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., {{a}} + 1, "x" & "y")
 */
public record BinaryExpressionNode(
        ExpressionNode left,
        BinaryOperator operator,
        ExpressionNode right
) implements ExpressionNode {

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
