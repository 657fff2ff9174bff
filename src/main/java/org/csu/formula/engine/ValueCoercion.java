package org.csu.formula.engine;

import org.csu.formula.common.exception.EvaluationException;
import org.csu.formula.common.model.Value;
import org.csu.formula.compiler.parser.ast.expression.ComparisonOperator;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 运算符与内置函数共用的类型转换规则: 数值、可比较值、真值、空白判断以及文本表示。
 */
public final class ValueCoercion {

    /** 电子表格序列日期的纪元 */
    public static final LocalDate SERIAL_EPOCH = LocalDate.of(1899, 12, 30);

    private static final double SECONDS_PER_DAY = 86_400d;
    private static final Pattern NUMERIC_TEXT = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final DateTimeFormatter DATE_TIME_TEXT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter TIME_TEXT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private ValueCoercion() {
    }

    // ---------------------------------------------------------------- numbers

    /**
     * Null 为 0，布尔为 1/0，日期为自 1899-12-30 起的天数 (小数部分表示一天中的时间)，
     * 文本去掉首尾空白后按整数或小数解析 (空白为 0)。
     */
    public static double toNumber(Value value) {
        Value v = value.resolve();
        switch (v.getType()) {
            case NULL:
                return 0d;
            case BOOLEAN:
                return v.asBoolean() ? 1d : 0d;
            case NUMBER:
                return v.asNumber().doubleValue();
            case DATE:
                return ChronoUnit.DAYS.between(SERIAL_EPOCH, (LocalDate) v.getValue());
            case DATETIME: {
                LocalDateTime dateTime = (LocalDateTime) v.getValue();
                return ChronoUnit.DAYS.between(SERIAL_EPOCH, dateTime.toLocalDate())
                        + dateTime.toLocalTime().toSecondOfDay() / SECONDS_PER_DAY;
            }
            case TIME:
                return ((LocalTime) v.getValue()).toSecondOfDay() / SECONDS_PER_DAY;
            case TEXT:
                return parseNumber(v.asText());
            default:
                throw new EvaluationException("Unsupported value type '" + v.getType() + "' for numeric coercion.");
        }
    }

    /**
     * 与 {@link #toNumber(Value)} 相同，但结果保持为 Value，整数值保持整数。
     */
    public static Value toNumberValue(Value value) {
        Value v = value.resolve();
        if (v.isNumber()) {
            return v;
        }
        return normalizeNumber(toNumber(v));
    }

    public static boolean isNumeric(Value value) {
        try {
            toNumber(value);
            return true;
        } catch (EvaluationException e) {
            return false;
        }
    }

    /**
     * 恰好为整数的浮点结果收敛为整数 Value。
     */
    public static Value normalizeNumber(double number) {
        if (Double.isFinite(number) && number == Math.rint(number)
                && number >= Long.MIN_VALUE && number <= Long.MAX_VALUE) {
            return Value.of((long) number);
        }
        return Value.of(number);
    }

    /**
     * 向零截断为 int，用于位置、长度、位数等参数。
     */
    public static int toInt(Value value) {
        double number = toNumber(value);
        if (Double.isNaN(number)) {
            throw new EvaluationException("Cannot use NaN as an integer argument.");
        }
        if (number > Integer.MAX_VALUE || number < Integer.MIN_VALUE) {
            throw new EvaluationException("Integer argument out of range: " + toText(value));
        }
        return (int) number;
    }

    private static double parseNumber(String text) {
        String stripped = text.trim();
        if (stripped.isEmpty()) {
            return 0d;
        }
        if (!NUMERIC_TEXT.matcher(stripped).matches()) {
            throw new EvaluationException("Cannot convert '" + text + "' to a number.");
        }
        return Double.parseDouble(stripped);
    }

    // ---------------------------------------------------------------- comparison

    /**
     * 能转为数值的返回 Double，否则 Null 为空文本，其余为其文本表示。
     */
    public static Object toComparable(Value value) {
        Value v = value.resolve();
        try {
            return toNumber(v);
        } catch (EvaluationException e) {
            if (v.isNull()) {
                return "";
            }
            return toText(v);
        }
    }

    /**
     * 两个数值按大小比较，两个文本按字典序 (区分大小写)，数值总是排在文本之前。
     */
    public static int compare(Value left, Value right) {
        return compareComparables(toComparable(left), toComparable(right));
    }

    /**
     * 比较运算符的求值。NaN 与任何值都无序：只有 &lt;&gt; 成立，其余比较均为 false。
     */
    public static boolean compare(ComparisonOperator operator, Value left, Value right) {
        Object l = toComparable(left);
        Object r = toComparable(right);
        if (isNaN(l) || isNaN(r)) {
            return operator == ComparisonOperator.NOT_EQUAL;
        }
        return operator.test(compareComparables(l, r));
    }

    private static boolean isNaN(Object comparable) {
        return comparable instanceof Double d && d.isNaN();
    }

    private static int compareComparables(Object l, Object r) {
        if (l instanceof Double a && r instanceof Double b) {
            return a < b ? -1 : (a > b ? 1 : 0);
        }
        if (l instanceof String a && r instanceof String b) {
            return Integer.signum(a.compareTo(b));
        }
        return l instanceof Double ? -1 : 1;
    }

    // ---------------------------------------------------------------- truthiness

    public static boolean isTruthy(Value value) {
        Value v = value.resolve();
        return switch (v.getType()) {
            case NULL -> false;
            case BOOLEAN -> v.asBoolean();
            case NUMBER -> v.asNumber().doubleValue() != 0d;
            case TEXT -> !v.asText().isBlank();
            case SEQUENCE -> !v.asSequence().isEmpty();
            default -> true;
        };
    }

    public static boolean isBlank(Value value) {
        Value v = value.resolve();
        return switch (v.getType()) {
            case NULL -> true;
            case TEXT -> v.asText().isBlank();
            case SEQUENCE -> v.asSequence().isEmpty();
            default -> false;
        };
    }

    // ---------------------------------------------------------------- text

    public static String toText(Value value) {
        Value v = value.resolve();
        switch (v.getType()) {
            case NULL:
                return "";
            case TEXT:
                return v.asText();
            case BOOLEAN:
                return v.asBoolean() ? "TRUE" : "FALSE";
            case NUMBER:
                return numberToText(v.asNumber());
            case DATE:
                return v.getValue().toString();
            case TIME:
                return TIME_TEXT.format((LocalTime) v.getValue());
            case DATETIME:
                return DATE_TIME_TEXT.format((LocalDateTime) v.getValue());
            case SEQUENCE: {
                List<Value> items = v.asSequence();
                return items.stream().map(ValueCoercion::toText).collect(Collectors.joining(", ", "[", "]"));
            }
            default:
                return String.valueOf(v.getValue());
        }
    }

    private static String numberToText(Number number) {
        if (!(number instanceof Double) && !(number instanceof Float)) {
            return number.toString();
        }
        double d = number.doubleValue();
        String text = Double.toString(d);
        if (!Double.isFinite(d) || text.indexOf('E') < 0) {
            return text;
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    // ---------------------------------------------------------------- date / time

    /**
     * 统一为 LocalDateTime: 日期补零点，时间补当天日期，文本按 ISO 日期时间/日期/时间依次尝试。
     */
    public static LocalDateTime toDateTime(Value value, Clock clock) {
        Value v = value.resolve();
        switch (v.getType()) {
            case DATETIME:
                return (LocalDateTime) v.getValue();
            case DATE:
                return ((LocalDate) v.getValue()).atStartOfDay();
            case TIME:
                return LocalDate.now(clock).atTime((LocalTime) v.getValue());
            case TEXT: {
                LocalDateTime parsed = parseDateTime(v.asText().trim(), clock);
                if (parsed != null) {
                    return parsed;
                }
                break;
            }
            default:
                break;
        }
        throw new EvaluationException("Cannot interpret '" + toText(v) + "' as a date/time value.");
    }

    private static LocalDateTime parseDateTime(String text, Clock clock) {
        String isoText = text.length() > 10 && text.charAt(10) == ' '
                ? text.substring(0, 10) + 'T' + text.substring(11)
                : text;
        return tryParse(isoText, LocalDateTime::parse)
                .or(() -> tryParse(text, LocalDate::parse).map(LocalDate::atStartOfDay))
                .or(() -> tryParse(text, LocalTime::parse).map(time -> LocalDate.now(clock).atTime(time)))
                .orElse(null);
    }

    private static <T> Optional<T> tryParse(String text, Function<CharSequence, T> parser) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
