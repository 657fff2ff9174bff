package org.csu.formula.compiler.parser.ast.expression;

import org.csu.formula.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 一元正负号 (e.g., -{{price}})
 */
public record UnaryExpressionNode(UnaryOperator operator, ExpressionNode operand) implements ExpressionNode {

    @Override
    public String toString() {
        return operator.symbol() + operand;
    }
}
