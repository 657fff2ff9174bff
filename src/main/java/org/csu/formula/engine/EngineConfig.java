package org.csu.formula.engine;

import lombok.Getter;
import lombok.Setter;

import java.time.Clock;
import java.util.Objects;

/**
 * 引擎配置。构造 FormulaEngine / FunctionRegistry 之后再修改不会影响已注册的内置函数所用的时钟。
 */
@Getter
@Setter
public class EngineConfig {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    // 解析与求值的最大嵌套深度，超过后报错而不是耗尽调用栈
    private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

    // true: 查找函数前把被移除的内置函数补回; false: 移除即永久移除
    private boolean restoreMissingDefaults = true;

    // 是否在控制台打印注册表的生命周期事件
    private boolean verbose = false;

    // NOW() / TODAY() 以及只含时间的值补全日期时使用
    private Clock clock = Clock.systemDefaultZone();

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public EngineConfig withClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    public EngineConfig withMaxNestingDepth(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
        return this;
    }

    public EngineConfig withRestoreMissingDefaults(boolean restoreMissingDefaults) {
        this.restoreMissingDefaults = restoreMissingDefaults;
        return this;
    }

    public EngineConfig withVerbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }
}
