package org.csu.formula.compiler.parser.ast.expression;

import org.csu.formula.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 表示一个变量引用 {{name}}
 */
public record VariableNode(String name) implements ExpressionNode {

    @Override
    public String toString() {
        return "{{" + name + "}}";
    }
}
