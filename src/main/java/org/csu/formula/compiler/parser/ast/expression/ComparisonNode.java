package org.csu.formula.compiler.parser.ast.expression;

import org.csu.formula.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 表示一个比较表达式 (e.g., {{age}} > 20)
 */
public record ComparisonNode(
        ExpressionNode left,
        ComparisonOperator operator,
        ExpressionNode right
) implements ExpressionNode {

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
