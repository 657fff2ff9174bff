package org.csu.formula.compiler.parser.ast.expression;

import org.csu.formula.compiler.parser.ast.ExpressionNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST 节点: 表示一个函数调用, e.g., SUM(1; {{b}})
 * @param name      大写的函数名
 * @param arguments 参数表达式，可以为空
 */
public record FunctionCallNode(String name, List<ExpressionNode> arguments) implements ExpressionNode {

    public FunctionCallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String toString() {
        return name + arguments.stream().map(Object::toString).collect(Collectors.joining("; ", "(", ")"));
    }
}
