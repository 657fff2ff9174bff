package org.csu.formula.compiler.semantic;

import org.csu.formula.common.exception.SemanticException;
import org.csu.formula.compiler.parser.ast.ExpressionNode;
import org.csu.formula.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.formula.compiler.parser.ast.expression.ComparisonNode;
import org.csu.formula.compiler.parser.ast.expression.FunctionCallNode;
import org.csu.formula.compiler.parser.ast.expression.LiteralNode;
import org.csu.formula.compiler.parser.ast.expression.UnaryExpressionNode;
import org.csu.formula.compiler.parser.ast.expression.VariableNode;
import org.csu.formula.function.FunctionRegistry;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * @author hidyouth
 * @description: 公式的静态分析器
 * 不求值，只遍历语法树收集引用的变量与函数；validate 在求值之前检查这些引用是否都存在。
 */
public class FormulaAnalyzer {

    private final FunctionRegistry registry;

    public FormulaAnalyzer(FunctionRegistry registry) {
        this.registry = registry;
    }

    public FormulaDescription describe(ExpressionNode ast) {
        Set<String> variables = new HashSet<>();
        Set<String> functions = new HashSet<>();
        collect(ast, variables, functions);
        return new FormulaDescription(ast, variables, functions);
    }

    private void collect(ExpressionNode node, Set<String> variables, Set<String> functions) {
        if (node instanceof VariableNode variable) {
            variables.add(variable.name());
        } else if (node instanceof FunctionCallNode call) {
            functions.add(call.name());
            for (ExpressionNode argument : call.arguments()) {
                collect(argument, variables, functions);
            }
        } else if (node instanceof UnaryExpressionNode unary) {
            collect(unary.operand(), variables, functions);
        } else if (node instanceof BinaryExpressionNode binary) {
            collect(binary.left(), variables, functions);
            collect(binary.right(), variables, functions);
        } else if (node instanceof ComparisonNode comparison) {
            collect(comparison.left(), variables, functions);
            collect(comparison.right(), variables, functions);
        } else if (!(node instanceof LiteralNode)) {
            throw new IllegalStateException("Unsupported node type in formula: " + node.getClass().getSimpleName());
        }
    }

    /**
     * 检查描述中的每个变量都在 knownVariables 中、每个函数都已注册。
     * 所有缺失项一次性报告。
     */
    public void validate(FormulaDescription description, Collection<String> knownVariables) {
        Set<String> missingVariables = new TreeSet<>(description.variables());
        missingVariables.removeAll(knownVariables);
        Set<String> missingFunctions = new TreeSet<>();
        for (String function : description.functions()) {
            if (!registry.contains(function)) {
                missingFunctions.add(function);
            }
        }
        if (missingVariables.isEmpty() && missingFunctions.isEmpty()) {
            return;
        }
        StringBuilder message = new StringBuilder();
        if (!missingVariables.isEmpty()) {
            message.append("Unknown variables: ").append(String.join(", ", missingVariables)).append('.');
        }
        if (!missingFunctions.isEmpty()) {
            if (message.length() > 0) {
                message.append(' ');
            }
            message.append("Unknown functions: ").append(String.join(", ", missingFunctions)).append('.');
        }
        throw new SemanticException(message.toString());
    }
}
