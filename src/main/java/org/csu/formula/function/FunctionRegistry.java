package org.csu.formula.function;

import org.csu.formula.engine.EngineConfig;
import org.csu.formula.function.builtin.DateTimeFunctions;
import org.csu.formula.function.builtin.LogicalFunctions;
import org.csu.formula.function.builtin.MathFunctions;
import org.csu.formula.function.builtin.TextFunctions;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 函数注册表，按大写名称索引。
 * 读操作无锁 (ConcurrentHashMap)，所有修改在注册表锁内进行。
 * <p>
 * 内置函数同时记录在默认表中。{@link EngineConfig#isRestoreMissingDefaults()} 为 true 时，
 * 每次查找前会把缺失的内置函数补回 (不会覆盖调用方重新注册的同名函数)。
 */
public class FunctionRegistry {

    private final Map<String, FunctionDescriptor> functions = new ConcurrentHashMap<>();
    private final Map<String, FunctionDescriptor> defaults = new ConcurrentHashMap<>();
    private final EngineConfig config;
    private final Object lock = new Object();

    public FunctionRegistry() {
        this(EngineConfig.defaults());
    }

    public FunctionRegistry(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        LogicalFunctions.registerAll(this);
        MathFunctions.registerAll(this);
        TextFunctions.registerAll(this, config.getClock());
        DateTimeFunctions.registerAll(this, config.getClock());
    }

    /**
     * 注册一个默认函数: 它既进入当前函数表，也成为缺失时可以被补回的默认实现。
     */
    public final void registerDefault(FunctionDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        synchronized (lock) {
            defaults.put(descriptor.name(), descriptor);
            functions.put(descriptor.name(), descriptor);
        }
    }

    public Optional<FunctionDescriptor> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        ensureDefaults();
        return Optional.ofNullable(functions.get(canonical(name)));
    }

    /**
     * 以不限参数个数、无额外能力的方式注册函数，覆盖同名函数。
     */
    public void register(String name, FormulaFunction function) {
        register(FunctionDescriptor.variadic(name, 0, function));
    }

    public void register(FunctionDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        synchronized (lock) {
            ensureDefaults();
            FunctionDescriptor previous = functions.put(descriptor.name(), descriptor);
            if (previous != null && defaults.get(descriptor.name()) == previous) {
                log("Built-in function '" + descriptor.name() + "' overridden by a custom implementation.");
            }
        }
    }

    public boolean unregister(String name) {
        if (name == null) {
            return false;
        }
        synchronized (lock) {
            boolean removed = functions.remove(canonical(name)) != null;
            if (removed) {
                log("Unregistered function '" + canonical(name) + "'.");
            }
            return removed;
        }
    }

    public boolean contains(String name) {
        return lookup(name).isPresent();
    }

    /**
     * 当前可用的函数名 (排序)。
     */
    public Set<String> names() {
        ensureDefaults();
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }

    public Set<String> defaultNames() {
        return Collections.unmodifiableSet(new TreeSet<>(defaults.keySet()));
    }

    private void ensureDefaults() {
        if (!config.isRestoreMissingDefaults() || functions.keySet().containsAll(defaults.keySet())) {
            return;
        }
        synchronized (lock) {
            for (Map.Entry<String, FunctionDescriptor> entry : defaults.entrySet()) {
                if (functions.putIfAbsent(entry.getKey(), entry.getValue()) == null) {
                    log("Restored default function '" + entry.getKey() + "'.");
                }
            }
        }
    }

    private void log(String message) {
        if (config.isVerbose()) {
            System.out.println("[FunctionRegistry] " + message);
        }
    }

    private static String canonical(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }
}
