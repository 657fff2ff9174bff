package org.csu.formula.function;

import lombok.Getter;
import org.csu.formula.common.model.Value;
import org.csu.formula.engine.EvaluationContext;

import java.util.List;

/**
 * 一次函数调用: 函数名、已求值的参数，以及按声明的能力注入的上下文与注册表。
 */
public final class FunctionInvocation {

    @Getter
    private final String name;
    @Getter
    private final List<Value> arguments;
    private final EvaluationContext context;
    private final FunctionRegistry registry;

    public FunctionInvocation(String name, List<Value> arguments,
                              EvaluationContext context, FunctionRegistry registry) {
        this.name = name;
        this.arguments = List.copyOf(arguments);
        this.context = context;
        this.registry = registry;
    }

    public int size() {
        return arguments.size();
    }

    public Value arg(int index) {
        return arguments.get(index).resolve();
    }

    public Value argOrDefault(int index, Value defaultValue) {
        return index < arguments.size() ? arg(index) : defaultValue;
    }

    public boolean has(int index) {
        return index < arguments.size();
    }

    /**
     * 仅当函数声明了 {@link Capability#CONTEXT} 时可用。
     */
    public EvaluationContext context() {
        if (context == null) {
            throw new IllegalStateException("Function '" + name + "' did not declare the CONTEXT capability");
        }
        return context;
    }

    /**
     * 仅当函数声明了 {@link Capability#REGISTRY} 时可用。
     */
    public FunctionRegistry registry() {
        if (registry == null) {
            throw new IllegalStateException("Function '" + name + "' did not declare the REGISTRY capability");
        }
        return registry;
    }
}
