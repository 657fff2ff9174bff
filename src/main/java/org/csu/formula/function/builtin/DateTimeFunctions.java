package org.csu.formula.function.builtin;

import org.csu.formula.common.model.Value;
import org.csu.formula.engine.ValueCoercion;
import org.csu.formula.function.FunctionDescriptor;
import org.csu.formula.function.FunctionRegistry;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.function.ToIntFunction;

/**
 * 日期时间函数。NOW / TODAY 读取注册时传入的时钟，测试中可注入固定时钟。
 */
public final class DateTimeFunctions {

    private DateTimeFunctions() {
    }

    public static void registerAll(FunctionRegistry r, Clock clock) {
        r.registerDefault(FunctionDescriptor.of("NOW", 0, 0, inv -> Value.of(LocalDateTime.now(clock))));
        r.registerDefault(FunctionDescriptor.of("TODAY", 0, 0, inv -> Value.of(LocalDate.now(clock))));

        r.registerDefault(FunctionDescriptor.of("DATE", 3, 3, inv -> Value.of(LocalDate.of(
                ValueCoercion.toInt(inv.arg(0)),
                ValueCoercion.toInt(inv.arg(1)),
                ValueCoercion.toInt(inv.arg(2))))));
        r.registerDefault(FunctionDescriptor.of("TIME", 2, 3, inv -> Value.of(LocalTime.of(
                ValueCoercion.toInt(inv.arg(0)),
                ValueCoercion.toInt(inv.arg(1)),
                ValueCoercion.toInt(inv.argOrDefault(2, Value.of(0L)))))));

        registerPart(r, clock, "YEAR", LocalDateTime::getYear);
        registerPart(r, clock, "MONTH", LocalDateTime::getMonthValue);
        registerPart(r, clock, "DAY", LocalDateTime::getDayOfMonth);
        registerPart(r, clock, "HOUR", LocalDateTime::getHour);
        registerPart(r, clock, "MINUTE", LocalDateTime::getMinute);
        registerPart(r, clock, "SECOND", LocalDateTime::getSecond);
    }

    private static void registerPart(FunctionRegistry r, Clock clock, String name, ToIntFunction<LocalDateTime> part) {
        r.registerDefault(FunctionDescriptor.of(name, 1, 1,
                inv -> Value.of((long) part.applyAsInt(ValueCoercion.toDateTime(inv.arg(0), clock)))));
    }
}
