package org.csu.formula.function.builtin;

import org.csu.formula.common.exception.EvaluationException;
import org.csu.formula.common.model.Value;
import org.csu.formula.common.model.ValueType;
import org.csu.formula.engine.ValueCoercion;
import org.csu.formula.function.FunctionDescriptor;
import org.csu.formula.function.FunctionRegistry;

import java.util.List;

/**
 * 条件与逻辑函数: IF, IFS, SWITCH, AND, OR, NOT, ISNUMBER, ISTEXT, ISBLANK。
 */
public final class LogicalFunctions {

    private LogicalFunctions() {
    }

    public static void registerAll(FunctionRegistry r) {
        r.registerDefault(FunctionDescriptor.of("IF", 2, 3, inv ->
                ValueCoercion.isTruthy(inv.arg(0)) ? inv.arg(1) : inv.argOrDefault(2, Value.NULL)));

        r.registerDefault(FunctionDescriptor.variadic("IFS", 2, inv -> {
            List<Value> args = inv.getArguments();
            if (args.size() % 2 != 0) {
                throw new EvaluationException("IFS requires condition/value pairs.");
            }
            for (int i = 0; i < args.size(); i += 2) {
                if (ValueCoercion.isTruthy(inv.arg(i))) {
                    return inv.arg(i + 1);
                }
            }
            throw new EvaluationException("IFS did not match any condition.");
        }));

        // SWITCH(expr; case1; value1; ...; [default])，case 之后剩余奇数个参数时最后一个是默认值
        r.registerDefault(FunctionDescriptor.variadic("SWITCH", 2, inv -> {
            Value expression = inv.arg(0);
            int caseCount = inv.size() - 1;
            boolean hasDefault = caseCount % 2 == 1;
            int pairsEnd = hasDefault ? inv.size() - 1 : inv.size();
            for (int i = 1; i + 1 < pairsEnd; i += 2) {
                if (caseMatches(expression, inv.arg(i))) {
                    return inv.arg(i + 1);
                }
            }
            if (hasDefault) {
                return inv.arg(inv.size() - 1);
            }
            throw new EvaluationException("SWITCH did not match any case.");
        }));

        r.registerDefault(FunctionDescriptor.variadic("AND", 0, inv -> {
            for (Value v : inv.getArguments()) {
                if (!ValueCoercion.isTruthy(v)) {
                    return Value.FALSE;
                }
            }
            return Value.TRUE;
        }));
        r.registerDefault(FunctionDescriptor.variadic("OR", 0, inv -> {
            for (Value v : inv.getArguments()) {
                if (ValueCoercion.isTruthy(v)) {
                    return Value.TRUE;
                }
            }
            return Value.FALSE;
        }));
        r.registerDefault(FunctionDescriptor.of("NOT", 1, 1, inv -> Value.of(!ValueCoercion.isTruthy(inv.arg(0)))));

        r.registerDefault(FunctionDescriptor.of("ISNUMBER", 1, 1, inv -> Value.of(ValueCoercion.isNumeric(inv.arg(0)))));
        r.registerDefault(FunctionDescriptor.of("ISTEXT", 1, 1, inv -> Value.of(inv.arg(0).isText())));
        r.registerDefault(FunctionDescriptor.of("ISBLANK", 1, 1, inv -> Value.of(ValueCoercion.isBlank(inv.arg(0)))));
    }

    // 布尔与数值之间按数值相等 (TRUE 等于 1)，文本与数值不相等
    private static boolean caseMatches(Value expression, Value candidate) {
        if (expression.equals(candidate)) {
            return true;
        }
        if (isNumberLike(expression) && isNumberLike(candidate)) {
            return ValueCoercion.toNumber(expression) == ValueCoercion.toNumber(candidate);
        }
        return false;
    }

    private static boolean isNumberLike(Value value) {
        return value.isNumber() || value.getType() == ValueType.BOOLEAN;
    }
}
