package org.csu.formula.function;

import org.csu.formula.common.exception.EvaluationException;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 注册表中的一个函数条目: 规范化 (大写) 的名称、参数个数范围、声明的能力以及实现。
 */
public record FunctionDescriptor(String name, int minArgs, int maxArgs,
                                 Set<Capability> capabilities, FormulaFunction function) {

    public static final int VARIADIC = Integer.MAX_VALUE;

    public FunctionDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(function, "function");
        name = name.trim().toUpperCase(Locale.ROOT);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Function name must not be blank");
        }
        if (minArgs < 0 || maxArgs < minArgs) {
            throw new IllegalArgumentException("Invalid arity " + minArgs + ".." + maxArgs + " for function " + name);
        }
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(capabilities));
    }

    public static FunctionDescriptor of(String name, int minArgs, int maxArgs, FormulaFunction function) {
        return new FunctionDescriptor(name, minArgs, maxArgs, Set.of(), function);
    }

    public static FunctionDescriptor variadic(String name, int minArgs, FormulaFunction function) {
        return new FunctionDescriptor(name, minArgs, VARIADIC, Set.of(), function);
    }

    public FunctionDescriptor withCapabilities(Capability first, Capability... rest) {
        return new FunctionDescriptor(name, minArgs, maxArgs, EnumSet.of(first, rest), function);
    }

    public boolean has(Capability capability) {
        return capabilities.contains(capability);
    }

    public void checkArity(int count) {
        if (count >= minArgs && count <= maxArgs) {
            return;
        }
        String expected;
        if (maxArgs == VARIADIC) {
            expected = "at least " + minArgs;
        } else if (minArgs == maxArgs) {
            expected = String.valueOf(minArgs);
        } else {
            expected = minArgs + " to " + maxArgs;
        }
        boolean singular = expected.equals("1") || expected.equals("at least 1");
        throw new EvaluationException(String.format("Function '%s' expects %s argument%s but got %d.",
                name, expected, singular ? "" : "s", count));
    }
}
