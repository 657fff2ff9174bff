package org.csu.formula.function.builtin;

import org.csu.formula.common.exception.EvaluationException;
import org.csu.formula.common.model.Value;
import org.csu.formula.engine.ValueCoercion;
import org.csu.formula.function.FunctionDescriptor;
import org.csu.formula.function.FunctionInvocation;
import org.csu.formula.function.FunctionRegistry;
import org.csu.formula.function.FunctionSupport;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 文本函数。位置参数均从 1 开始，越界时截断而不报错。
 */
public final class TextFunctions {

    // TEXT() 中日期格式记号到 DateTimeFormatter 模式的映射，按顺序匹配
    private static final String[][] DATE_TOKENS = {
            {"YYYY", "yyyy"},
            {"YY", "yy"},
            {"MM", "MM"},
            {"DD", "dd"},
            {"HH", "HH"},
            {"hh", "hh"},
            {"mm", "mm"},
            {"ss", "ss"},
    };

    private static final String VALUE_PLACEHOLDER = "{value}";

    private TextFunctions() {
    }

    public static void registerAll(FunctionRegistry r, Clock clock) {
        r.registerDefault(FunctionDescriptor.of("LEN", 1, 1, inv -> {
            String text = text(inv, 0);
            return Value.of((long) text.codePointCount(0, text.length()));
        }));

        r.registerDefault(FunctionDescriptor.variadic("CONCAT", 0, TextFunctions::concat));
        r.registerDefault(FunctionDescriptor.variadic("CONCATENATE", 0, TextFunctions::concat));
        r.registerDefault(FunctionDescriptor.variadic("TEXTJOIN", 2, TextFunctions::textJoin));

        r.registerDefault(FunctionDescriptor.of("LOWER", 1, 1, inv -> Value.text(text(inv, 0).toLowerCase(Locale.ROOT))));
        r.registerDefault(FunctionDescriptor.of("UPPER", 1, 1, inv -> Value.text(text(inv, 0).toUpperCase(Locale.ROOT))));
        r.registerDefault(FunctionDescriptor.of("PROPER", 1, 1, inv -> {
            StringJoiner joiner = new StringJoiner(" ");
            for (String word : words(text(inv, 0))) {
                joiner.add(word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT));
            }
            return Value.text(joiner.toString());
        }));
        r.registerDefault(FunctionDescriptor.of("TRIM", 1, 1, inv -> Value.text(String.join(" ", words(text(inv, 0))))));

        r.registerDefault(FunctionDescriptor.of("SUBSTITUTE", 3, 4, TextFunctions::substitute));
        r.registerDefault(FunctionDescriptor.of("REPLACE", 4, 4, inv -> {
            String source = text(inv, 0);
            int start = clamp(ValueCoercion.toInt(inv.arg(1)) - 1, source.length());
            int end = clamp(start + Math.max(ValueCoercion.toInt(inv.arg(2)), 0), source.length());
            return Value.text(source.substring(0, start) + text(inv, 3) + source.substring(end));
        }));

        r.registerDefault(FunctionDescriptor.of("LEFT", 1, 2, inv ->
                FunctionSupport.vectorizeBinary(inv.arg(0), inv.argOrDefault(1, Value.of(1L)), (value, count) -> {
                    String source = ValueCoercion.toText(value);
                    return Value.text(source.substring(0, clamp(ValueCoercion.toInt(count), source.length())));
                })));
        r.registerDefault(FunctionDescriptor.of("RIGHT", 1, 2, inv ->
                FunctionSupport.vectorizeBinary(inv.arg(0), inv.argOrDefault(1, Value.of(1L)), (value, count) -> {
                    String source = ValueCoercion.toText(value);
                    int size = clamp(ValueCoercion.toInt(count), source.length());
                    return Value.text(source.substring(source.length() - size));
                })));
        r.registerDefault(FunctionDescriptor.of("MID", 3, 3, inv -> {
            String source = text(inv, 0);
            int start = clamp(ValueCoercion.toInt(inv.arg(1)) - 1, source.length());
            int end = clamp(start + Math.max(ValueCoercion.toInt(inv.arg(2)), 0), source.length());
            return Value.text(source.substring(start, end));
        }));

        r.registerDefault(FunctionDescriptor.of("SEARCH", 2, 3, inv -> find(inv, false)));
        r.registerDefault(FunctionDescriptor.of("FIND", 2, 3, inv -> find(inv, true)));

        r.registerDefault(FunctionDescriptor.of("SPLIT", 2, 2, inv -> {
            String delimiter = text(inv, 1);
            if (delimiter.isEmpty()) {
                throw new IllegalArgumentException("empty delimiter");
            }
            List<Value> parts = new ArrayList<>();
            for (String part : text(inv, 0).split(Pattern.quote(delimiter), -1)) {
                parts.add(Value.text(part));
            }
            return Value.sequence(parts);
        }));

        r.registerDefault(FunctionDescriptor.of("VALUE", 1, 1, inv -> ValueCoercion.toNumberValue(inv.arg(0))));

        // 单个标量参数原样返回，其余情况展平为一个序列
        r.registerDefault(FunctionDescriptor.variadic("ARRAYFORMULA", 0, inv -> {
            if (inv.size() == 1 && !inv.arg(0).isSequence()) {
                return inv.arg(0);
            }
            return Value.sequence(FunctionSupport.flatten(inv.getArguments()));
        }));

        r.registerDefault(FunctionDescriptor.of("TO_TEXT", 1, 1, inv -> Value.text(text(inv, 0))));
        r.registerDefault(FunctionDescriptor.of("TEXT", 2, 2, inv -> Value.text(format(inv.arg(0), text(inv, 1), clock))));
        r.registerDefault(FunctionDescriptor.of("REGEXREPLACE", 3, 3, TextFunctions::regexReplace));
    }

    private static String text(FunctionInvocation inv, int index) {
        return ValueCoercion.toText(inv.arg(index));
    }

    private static int clamp(int index, int length) {
        return Math.max(0, Math.min(index, length));
    }

    private static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        for (String word : text.trim().split("\\s+")) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    private static Value concat(FunctionInvocation inv) {
        StringBuilder sb = new StringBuilder();
        for (Value v : FunctionSupport.flatten(inv.getArguments())) {
            if (!v.isNull()) {
                sb.append(ValueCoercion.toText(v));
            }
        }
        return Value.text(sb.toString());
    }

    private static Value textJoin(FunctionInvocation inv) {
        String separator = text(inv, 0);
        Value flag = inv.arg(1);
        boolean ignoreEmpty;
        if (flag.isText()) {
            String normalized = flag.asText().trim().toUpperCase(Locale.ROOT);
            ignoreEmpty = normalized.equals("TRUE") || normalized.equals("1");
        } else {
            ignoreEmpty = ValueCoercion.isTruthy(flag);
        }
        StringJoiner joiner = new StringJoiner(separator);
        for (Value v : FunctionSupport.flatten(inv.getArguments().subList(2, inv.size()))) {
            if (ignoreEmpty && ValueCoercion.isBlank(v)) {
                continue;
            }
            joiner.add(ValueCoercion.toText(v));
        }
        return Value.text(joiner.toString());
    }

    /**
     * 不带 occurrence 时替换全部；带 occurrence 时只替换第 n 次出现 (n <= 0 或不存在时原样返回)。
     */
    private static Value substitute(FunctionInvocation inv) {
        String source = text(inv, 0);
        String oldText = text(inv, 1);
        String newText = text(inv, 2);
        Value occurrence = inv.argOrDefault(3, Value.NULL);
        if (occurrence.isNull()) {
            return Value.text(source.replace(oldText, newText));
        }
        int index = ValueCoercion.toInt(occurrence);
        if (index <= 0) {
            return Value.text(source);
        }
        if (oldText.isEmpty()) {
            throw new IllegalArgumentException("empty search text");
        }
        String[] parts = source.split(Pattern.quote(oldText), -1);
        if (parts.length <= index) {
            return Value.text(source);
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length - 1; i++) {
            sb.append(parts[i]).append(i + 1 == index ? newText : oldText);
        }
        sb.append(parts[parts.length - 1]);
        return Value.text(sb.toString());
    }

    private static Value find(FunctionInvocation inv, boolean caseSensitive) {
        String needle = text(inv, 0);
        String haystack = text(inv, 1);
        if (!caseSensitive) {
            needle = needle.toLowerCase(Locale.ROOT);
            haystack = haystack.toLowerCase(Locale.ROOT);
        }
        int start = inv.has(2) ? Math.max(ValueCoercion.toInt(inv.arg(2)) - 1, 0) : 0;
        int position = start > haystack.length() ? -1 : haystack.indexOf(needle, start);
        if (position < 0) {
            throw new EvaluationException(inv.getName() + " could not find the specified text.");
        }
        return Value.of((long) position + 1);
    }

    private static Value regexReplace(FunctionInvocation inv) {
        Pattern pattern;
        try {
            pattern = Pattern.compile(text(inv, 1));
        } catch (PatternSyntaxException e) {
            throw new EvaluationException("Invalid regular expression: " + e.getDescription(), e);
        }
        Matcher matcher = pattern.matcher(text(inv, 0));
        try {
            return Value.text(matcher.replaceAll(text(inv, 2)));
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            throw new EvaluationException("Invalid replacement string: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------- TEXT()

    static String format(Value value, String format, Clock clock) {
        if (value.getType().isTemporal()) {
            LocalDateTime dateTime = ValueCoercion.toDateTime(value, clock);
            return DateTimeFormatter.ofPattern(toDatePattern(format), Locale.ROOT).format(dateTime);
        }
        double number;
        try {
            number = ValueCoercion.toNumber(value);
        } catch (EvaluationException e) {
            return formatPlaceholder(value, format);
        }
        if (format.indexOf('#') >= 0 || format.indexOf('0') >= 0) {
            int dot = format.indexOf('.');
            int decimals = dot < 0 ? 0 : format.length() - dot - 1;
            return BigDecimal.valueOf(number).setScale(decimals, RoundingMode.HALF_UP).toPlainString();
        }
        try {
            return String.format(Locale.ROOT, "%" + format, number);
        } catch (IllegalFormatException e) {
            return ValueCoercion.toText(ValueCoercion.normalizeNumber(number));
        }
    }

    private static String formatPlaceholder(Value value, String format) {
        String text = ValueCoercion.toText(value);
        String rest = format.replace(VALUE_PLACEHOLDER, "");
        if (rest.indexOf('{') >= 0 || rest.indexOf('}') >= 0) {
            return text;
        }
        return format.replace(VALUE_PLACEHOLDER, text);
    }

    /**
     * 把 YYYY/MM/DD/HH/hh/mm/ss 记号翻译为 DateTimeFormatter 模式，其余字符按字面量引用。
     */
    static String toDatePattern(String format) {
        StringBuilder pattern = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        outer:
        while (i < format.length()) {
            for (String[] token : DATE_TOKENS) {
                if (format.startsWith(token[0], i)) {
                    appendLiteral(pattern, literal);
                    pattern.append(token[1]);
                    i += token[0].length();
                    continue outer;
                }
            }
            literal.append(format.charAt(i));
            i++;
        }
        appendLiteral(pattern, literal);
        return pattern.toString();
    }

    private static void appendLiteral(StringBuilder pattern, StringBuilder literal) {
        if (literal.length() == 0) {
            return;
        }
        pattern.append('\'').append(literal.toString().replace("'", "''")).append('\'');
        literal.setLength(0);
    }
}
