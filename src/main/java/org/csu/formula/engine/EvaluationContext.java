package org.csu.formula.engine;

import org.csu.formula.common.model.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 一次求值使用的变量表 (变量名 -> 值)，对引擎只读。
 * 值可以是 LAZY，读取时才计算。
 */
public final class EvaluationContext {

    private static final EvaluationContext EMPTY = new EvaluationContext(Map.of());

    private final Map<String, Value> variables;

    private EvaluationContext(Map<String, Value> variables) {
        this.variables = variables;
    }

    public static EvaluationContext empty() {
        return EMPTY;
    }

    /**
     * 由调用方的普通 Java 对象构建上下文，每个值经过 {@link Value#from(Object)} 转换。
     */
    public static EvaluationContext of(Map<String, ?> variables) {
        if (variables == null || variables.isEmpty()) {
            return EMPTY;
        }
        Map<String, Value> converted = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : variables.entrySet()) {
            converted.put(entry.getKey(), Value.from(entry.getValue()));
        }
        return new EvaluationContext(Collections.unmodifiableMap(converted));
    }

    public Optional<Value> lookup(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public Set<String> names() {
        return variables.keySet();
    }

    @Override
    public String toString() {
        return "EvaluationContext" + variables.keySet();
    }
}
