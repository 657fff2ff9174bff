package org.csu.formula.function.builtin;

import org.csu.formula.common.exception.EvaluationException;
import org.csu.formula.common.model.Value;
import org.csu.formula.engine.ValueCoercion;
import org.csu.formula.function.FunctionDescriptor;
import org.csu.formula.function.FunctionInvocation;
import org.csu.formula.function.FunctionRegistry;
import org.csu.formula.function.FunctionSupport;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.function.DoubleBinaryOperator;

/**
 * 数值函数: SUM, AVERAGE, MIN, MAX, ROUND, ROUNDUP, ROUNDDOWN。
 * 聚合函数先展平全部参数，再逐个转换为数值。
 */
public final class MathFunctions {

    private MathFunctions() {
    }

    public static void registerAll(FunctionRegistry r) {
        r.registerDefault(FunctionDescriptor.variadic("SUM", 0, inv -> {
            double total = 0d;
            for (double number : numbers(inv)) {
                total += number;
            }
            return ValueCoercion.normalizeNumber(total);
        }));

        r.registerDefault(FunctionDescriptor.variadic("AVERAGE", 0, inv -> {
            double[] numbers = requireNumbers(inv);
            double total = 0d;
            for (double number : numbers) {
                total += number;
            }
            return ValueCoercion.normalizeNumber(total / numbers.length);
        }));

        r.registerDefault(FunctionDescriptor.variadic("MIN", 0, inv -> reduce(requireNumbers(inv), Math::min)));
        r.registerDefault(FunctionDescriptor.variadic("MAX", 0, inv -> reduce(requireNumbers(inv), Math::max)));

        r.registerDefault(FunctionDescriptor.of("ROUND", 1, 2, inv -> round(inv, RoundingMode.HALF_UP)));
        r.registerDefault(FunctionDescriptor.of("ROUNDUP", 1, 2, inv -> round(inv, RoundingMode.UP)));
        r.registerDefault(FunctionDescriptor.of("ROUNDDOWN", 1, 2, inv -> round(inv, RoundingMode.DOWN)));
    }

    private static double[] numbers(FunctionInvocation inv) {
        List<Value> flat = FunctionSupport.flatten(inv.getArguments());
        double[] numbers = new double[flat.size()];
        for (int i = 0; i < numbers.length; i++) {
            numbers[i] = ValueCoercion.toNumber(flat.get(i));
        }
        return numbers;
    }

    private static double[] requireNumbers(FunctionInvocation inv) {
        double[] numbers = numbers(inv);
        if (numbers.length == 0) {
            throw new EvaluationException(inv.getName() + " requires at least one numeric value.");
        }
        return numbers;
    }

    private static Value reduce(double[] numbers, DoubleBinaryOperator operator) {
        double result = numbers[0];
        for (int i = 1; i < numbers.length; i++) {
            result = operator.applyAsDouble(result, numbers[i]);
        }
        return ValueCoercion.normalizeNumber(result);
    }

    /**
     * 在输入的十进制表示上按指定位数舍入 (位数可为负)，避免二进制浮点误差: ROUND(2.345; 2) = 2.35。
     */
    private static Value round(FunctionInvocation inv, RoundingMode mode) {
        double number = ValueCoercion.toNumber(inv.arg(0));
        int digits = inv.has(1) ? ValueCoercion.toInt(inv.arg(1)) : 0;
        if (!Double.isFinite(number)) {
            throw new EvaluationException("Cannot round non-finite number " + number + ".");
        }
        BigDecimal rounded = BigDecimal.valueOf(number).setScale(digits, mode);
        return ValueCoercion.normalizeNumber(rounded.doubleValue());
    }
}
