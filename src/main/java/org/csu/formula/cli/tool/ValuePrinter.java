package org.csu.formula.cli.tool;

import org.csu.formula.common.model.Value;
import org.csu.formula.engine.ValueCoercion;

import java.util.List;

/**
 * 将求值结果格式化为控制台输出。
 * 标量输出其文本形式，序列每个元素一行并带上下标 (嵌套序列下标逐级拼接)。
 */
public class ValuePrinter {

    public static String format(Value value) {
        Value v = value.resolve();
        if (v.isNull()) {
            return "NULL";
        }
        if (!v.isSequence()) {
            return ValueCoercion.toText(v);
        }
        if (v.asSequence().isEmpty()) {
            return "(empty sequence)";
        }
        StringBuilder sb = new StringBuilder();
        appendSequence(sb, "", v.asSequence());
        sb.setLength(sb.length() - 1);
        return sb.toString();
    }

    private static void appendSequence(StringBuilder sb, String prefix, List<Value> items) {
        for (int i = 0; i < items.size(); i++) {
            String index = prefix + "[" + i + "]";
            Value item = items.get(i).resolve();
            if (item.isSequence() && !item.asSequence().isEmpty()) {
                appendSequence(sb, index, item.asSequence());
            } else {
                sb.append(index).append(' ').append(item.isSequence() ? "(empty sequence)" : format(item)).append('\n');
            }
        }
    }
}
