package org.csu.formula.function;

import org.csu.formula.common.model.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

/**
 * 内置函数共用的序列工具: 展平与逐元素 (广播) 运算。
 */
public final class FunctionSupport {

    private FunctionSupport() {
    }

    /**
     * 深度优先展开任意嵌套的序列，保持顺序。
     */
    public static List<Value> flatten(List<Value> values) {
        List<Value> result = new ArrayList<>();
        flattenInto(values, result);
        return result;
    }

    private static void flattenInto(List<Value> values, List<Value> out) {
        for (Value value : values) {
            Value v = value.resolve();
            if (v.isSequence()) {
                flattenInto(v.asSequence(), out);
            } else {
                out.add(v);
            }
        }
    }

    public static Value vectorizeUnary(Value value, UnaryOperator<Value> operator) {
        Value v = value.resolve();
        if (!v.isSequence()) {
            return operator.apply(v);
        }
        List<Value> mapped = new ArrayList<>();
        for (Value item : v.asSequence()) {
            mapped.add(vectorizeUnary(item, operator));
        }
        return Value.sequence(mapped);
    }

    /**
     * 两侧都是序列时按位置配对 (以较短者为准)，只有一侧是序列时另一侧广播。
     */
    public static Value vectorizeBinary(Value left, Value right, BinaryOperator<Value> operator) {
        Value l = left.resolve();
        Value r = right.resolve();
        List<Value> mapped = new ArrayList<>();
        if (l.isSequence()) {
            List<Value> leftItems = l.asSequence();
            if (r.isSequence()) {
                List<Value> rightItems = r.asSequence();
                int size = Math.min(leftItems.size(), rightItems.size());
                for (int i = 0; i < size; i++) {
                    mapped.add(vectorizeBinary(leftItems.get(i), rightItems.get(i), operator));
                }
            } else {
                for (Value item : leftItems) {
                    mapped.add(vectorizeBinary(item, r, operator));
                }
            }
            return Value.sequence(mapped);
        }
        if (r.isSequence()) {
            for (Value item : r.asSequence()) {
                mapped.add(vectorizeBinary(l, item, operator));
            }
            return Value.sequence(mapped);
        }
        return operator.apply(l, r);
    }
}
