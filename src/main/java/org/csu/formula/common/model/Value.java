package org.csu.formula.common.model;

import lombok.Getter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * 表示公式中的一个具体的值，可以是不同数据类型。
 * 实例不可变；SEQUENCE 中的元素同样是 Value。
 */
@Getter
public final class Value {

    public static final Value NULL = new Value(ValueType.NULL, null);
    public static final Value TRUE = new Value(ValueType.BOOLEAN, Boolean.TRUE);
    public static final Value FALSE = new Value(ValueType.BOOLEAN, Boolean.FALSE);
    public static final Value EMPTY_TEXT = new Value(ValueType.TEXT, "");

    private final ValueType type;
    private final Object value;

    private Value(ValueType type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value of(long number) {
        return new Value(ValueType.NUMBER, number);
    }

    public static Value of(double number) {
        return new Value(ValueType.NUMBER, number);
    }

    public static Value of(boolean bool) {
        return bool ? TRUE : FALSE;
    }

    public static Value of(String text) {
        return text == null ? NULL : new Value(ValueType.TEXT, text);
    }

    public static Value text(String text) {
        return new Value(ValueType.TEXT, text == null ? "" : text);
    }

    public static Value of(LocalDate date) {
        return date == null ? NULL : new Value(ValueType.DATE, date);
    }

    public static Value of(LocalTime time) {
        return time == null ? NULL : new Value(ValueType.TIME, time);
    }

    public static Value of(LocalDateTime dateTime) {
        return dateTime == null ? NULL : new Value(ValueType.DATETIME, dateTime);
    }

    public static Value sequence(List<Value> items) {
        return new Value(ValueType.SEQUENCE, List.copyOf(items));
    }

    public static Value sequence(Value... items) {
        return new Value(ValueType.SEQUENCE, List.of(items));
    }

    /**
     * 延迟绑定，读取变量时才调用 supplier；supplier 的结果会经过 {@link #from(Object)} 转换。
     */
    public static Value lazy(Supplier<?> supplier) {
        return new Value(ValueType.LAZY, Objects.requireNonNull(supplier, "supplier"));
    }

    /**
     * 将调用方的普通 Java 对象转换为 Value。
     */
    public static Value from(Object object) {
        if (object == null) {
            return NULL;
        }
        if (object instanceof Value v) {
            return v;
        }
        if (object instanceof CharSequence || object instanceof Character) {
            return new Value(ValueType.TEXT, object.toString());
        }
        if (object instanceof Boolean b) {
            return of(b.booleanValue());
        }
        if (object instanceof Integer || object instanceof Long || object instanceof Short || object instanceof Byte) {
            return of(((Number) object).longValue());
        }
        if (object instanceof BigInteger big) {
            return big.bitLength() < 64 ? of(big.longValue()) : of(big.doubleValue());
        }
        if (object instanceof BigDecimal decimal) {
            if (decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0) {
                try {
                    return of(decimal.longValueExact());
                } catch (ArithmeticException e) {
                    return of(decimal.doubleValue());
                }
            }
            return of(decimal.doubleValue());
        }
        if (object instanceof Number n) {
            return of(n.doubleValue());
        }
        if (object instanceof LocalDateTime dateTime) {
            return of(dateTime);
        }
        // 带时区的时间取其本地墙上时间，Instant 按 UTC 展开
        if (object instanceof ZonedDateTime zoned) {
            return of(zoned.toLocalDateTime());
        }
        if (object instanceof OffsetDateTime offset) {
            return of(offset.toLocalDateTime());
        }
        if (object instanceof Instant instant) {
            return of(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
        }
        if (object instanceof LocalDate date) {
            return of(date);
        }
        if (object instanceof LocalTime time) {
            return of(time);
        }
        if (object instanceof Supplier<?> supplier) {
            return lazy(supplier);
        }
        if (object instanceof Iterable<?> iterable) {
            List<Value> items = new ArrayList<>();
            for (Object item : iterable) {
                items.add(from(item));
            }
            return sequence(items);
        }
        if (object instanceof Object[] array) {
            List<Value> items = new ArrayList<>(array.length);
            for (Object item : array) {
                items.add(from(item));
            }
            return sequence(items);
        }
        if (object instanceof Map<?, ?>) {
            throw new IllegalArgumentException("Maps cannot be bound as formula values");
        }
        throw new IllegalArgumentException("Unsupported value type: " + object.getClass().getName());
    }

    /**
     * 若为 LAZY，则反复调用直到得到具体值。
     */
    public Value resolve() {
        Value current = this;
        while (current.type == ValueType.LAZY) {
            current = from(((Supplier<?>) current.value).get());
        }
        return current;
    }

    public boolean isNull() {
        return type == ValueType.NULL;
    }

    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }

    public boolean isText() {
        return type == ValueType.TEXT;
    }

    public boolean isSequence() {
        return type == ValueType.SEQUENCE;
    }

    public Number asNumber() {
        requireType(ValueType.NUMBER);
        return (Number) value;
    }

    public String asText() {
        requireType(ValueType.TEXT);
        return (String) value;
    }

    public boolean asBoolean() {
        requireType(ValueType.BOOLEAN);
        return (Boolean) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asSequence() {
        if (type != ValueType.SEQUENCE) {
            return Collections.singletonList(this);
        }
        return (List<Value>) value;
    }

    private void requireType(ValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected a " + expected + " value but was " + type);
        }
    }

    @Override
    public String toString() {
        return type == ValueType.NULL ? "NULL" : type + "(" + value + ")";
    }

    // 数值按数值相等 (2 与 2.0 相等)，其余按类型 + 值
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        if (type == ValueType.NUMBER) {
            return ((Number) value).doubleValue() == ((Number) other.value).doubleValue();
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (type == ValueType.NUMBER) {
            double d = ((Number) value).doubleValue();
            return Double.hashCode(d == 0.0 ? 0.0 : d);
        }
        return Objects.hash(type, value);
    }
}
