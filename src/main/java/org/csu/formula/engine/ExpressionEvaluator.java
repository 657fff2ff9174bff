package org.csu.formula.engine;

import org.csu.formula.common.exception.EvaluationException;
import org.csu.formula.common.exception.FormulaException;
import org.csu.formula.common.model.Value;
import org.csu.formula.compiler.parser.ast.ExpressionNode;
import org.csu.formula.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.formula.compiler.parser.ast.expression.BinaryOperator;
import org.csu.formula.compiler.parser.ast.expression.ComparisonNode;
import org.csu.formula.compiler.parser.ast.expression.FunctionCallNode;
import org.csu.formula.compiler.parser.ast.expression.LiteralNode;
import org.csu.formula.compiler.parser.ast.expression.UnaryExpressionNode;
import org.csu.formula.compiler.parser.ast.expression.UnaryOperator;
import org.csu.formula.compiler.parser.ast.expression.VariableNode;
import org.csu.formula.function.Capability;
import org.csu.formula.function.FunctionDescriptor;
import org.csu.formula.function.FunctionInvocation;
import org.csu.formula.function.FunctionRegistry;
import org.csu.formula.function.FunctionSupport;

import java.util.ArrayList;
import java.util.List;

/**
 * 表达式求值器。
 * 对 AST 做后序遍历，函数参数全部先求值再调用函数；遇到第一个错误即终止。
 */
public class ExpressionEvaluator {

    private final FunctionRegistry registry;
    private final int maxDepth;

    public ExpressionEvaluator(FunctionRegistry registry, int maxDepth) {
        this.registry = registry;
        this.maxDepth = maxDepth;
    }

    public Value evaluate(ExpressionNode expression, EvaluationContext context) {
        return evaluate(expression, context, 0);
    }

    private Value evaluate(ExpressionNode expression, EvaluationContext context, int depth) {
        if (depth > maxDepth) {
            throw new EvaluationException("Formula nesting exceeds the maximum depth of " + maxDepth);
        }
        if (expression instanceof LiteralNode literal) {
            return literal.value();
        }
        if (expression instanceof VariableNode variable) {
            return readVariable(variable.name(), context);
        }
        if (expression instanceof UnaryExpressionNode unary) {
            double operand = ValueCoercion.toNumber(evaluate(unary.operand(), context, depth + 1));
            return ValueCoercion.normalizeNumber(unary.operator() == UnaryOperator.MINUS ? -operand : operand);
        }
        if (expression instanceof BinaryExpressionNode binary) {
            Value left = evaluate(binary.left(), context, depth + 1);
            Value right = evaluate(binary.right(), context, depth + 1);
            return applyOperator(binary.operator(), left, right);
        }
        if (expression instanceof ComparisonNode comparison) {
            Value left = evaluate(comparison.left(), context, depth + 1);
            Value right = evaluate(comparison.right(), context, depth + 1);
            return Value.of(ValueCoercion.compare(comparison.operator(), left, right));
        }
        if (expression instanceof FunctionCallNode call) {
            return callFunction(call, context, depth);
        }
        throw new EvaluationException("Unsupported expression type: " + expression.getClass().getSimpleName());
    }

    private Value readVariable(String name, EvaluationContext context) {
        Value value = context.lookup(name)
                .orElseThrow(() -> new EvaluationException("Unknown variable '" + name + "'."));
        try {
            return value.resolve();
        } catch (FormulaException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException("Error resolving variable '" + name + "': " + detail(e), e);
        }
    }

    private Value applyOperator(BinaryOperator operator, Value left, Value right) {
        if (operator == BinaryOperator.CONCAT) {
            StringBuilder sb = new StringBuilder();
            for (Value v : FunctionSupport.flatten(List.of(left, right))) {
                if (!v.isNull()) {
                    sb.append(ValueCoercion.toText(v));
                }
            }
            return Value.text(sb.toString());
        }
        double l = ValueCoercion.toNumber(left);
        double r = ValueCoercion.toNumber(right);
        double result = switch (operator) {
            case ADD -> l + r;
            case SUBTRACT -> l - r;
            case MULTIPLY -> l * r;
            case DIVIDE -> {
                if (r == 0d) {
                    throw new EvaluationException("Division by zero.");
                }
                yield l / r;
            }
            case POWER -> power(l, r);
            default -> throw new EvaluationException("Unsupported operator: " + operator.symbol());
        };
        return ValueCoercion.normalizeNumber(result);
    }

    private static double power(double base, double exponent) {
        double result = Math.pow(base, exponent);
        if (Double.isNaN(result) && !Double.isNaN(base) && !Double.isNaN(exponent)) {
            throw new EvaluationException("Math domain error in '^'.");
        }
        if (Double.isInfinite(result) && Double.isFinite(base) && Double.isFinite(exponent)) {
            throw new EvaluationException("Numeric overflow in '^'.");
        }
        return result;
    }

    private Value callFunction(FunctionCallNode call, EvaluationContext context, int depth) {
        FunctionDescriptor descriptor = registry.lookup(call.name())
                .orElseThrow(() -> new EvaluationException("Unknown function '" + call.name() + "'."));

        List<Value> arguments = new ArrayList<>(call.arguments().size());
        for (ExpressionNode argument : call.arguments()) {
            arguments.add(evaluate(argument, context, depth + 1));
        }
        descriptor.checkArity(arguments.size());

        FunctionInvocation invocation = new FunctionInvocation(descriptor.name(), arguments,
                descriptor.has(Capability.CONTEXT) ? context : null,
                descriptor.has(Capability.REGISTRY) ? registry : null);
        Value result;
        try {
            result = descriptor.function().apply(invocation);
        } catch (FormulaException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException("Error executing function '" + descriptor.name() + "': " + detail(e), e);
        }
        return result == null ? Value.NULL : result;
    }

    private static String detail(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
