package org.csu.formula.engine;

import org.csu.formula.common.exception.EvaluationException;
import org.csu.formula.common.model.Value;
import org.csu.formula.compiler.parser.ast.expression.ComparisonOperator;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ValueCoercionTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-15T08:00:00Z"), ZoneOffset.UTC);

    @Test
    void testToNumber() {
        System.out.println("--- Running test: testToNumber ---");
        assertEquals(0d, ValueCoercion.toNumber(Value.NULL));
        assertEquals(1d, ValueCoercion.toNumber(Value.TRUE));
        assertEquals(0d, ValueCoercion.toNumber(Value.FALSE));
        assertEquals(42d, ValueCoercion.toNumber(Value.of(42L)));
        assertEquals(-1.25, ValueCoercion.toNumber(Value.text("  -1.25 ")));
        assertEquals(1500d, ValueCoercion.toNumber(Value.text("1.5E3")));
        assertEquals(0d, ValueCoercion.toNumber(Value.text("   ")));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTemporalSerialNumbers() {
        System.out.println("--- Running test: testTemporalSerialNumbers ---");
        assertEquals(1d, ValueCoercion.toNumber(Value.of(LocalDate.of(1899, 12, 31))));
        assertEquals(45292d, ValueCoercion.toNumber(Value.of(LocalDate.of(2024, 1, 1))));
        assertEquals(0.5, ValueCoercion.toNumber(Value.of(LocalTime.NOON)));
        assertEquals(45292.25, ValueCoercion.toNumber(Value.of(LocalDateTime.of(2024, 1, 1, 6, 0))));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testInvalidNumericConversions() {
        System.out.println("--- Running test: testInvalidNumericConversions ---");
        EvaluationException text = assertThrows(EvaluationException.class,
                () -> ValueCoercion.toNumber(Value.text("12abc")));
        assertEquals("Cannot convert '12abc' to a number.", text.getMessage());

        EvaluationException sequence = assertThrows(EvaluationException.class,
                () -> ValueCoercion.toNumber(Value.sequence(Value.of(1L))));
        assertEquals("Unsupported value type 'SEQUENCE' for numeric coercion.", sequence.getMessage());
        assertFalse(ValueCoercion.isNumeric(Value.text("abc")));
        assertTrue(ValueCoercion.isNumeric(Value.text("3")));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testNormalizeNumber() {
        System.out.println("--- Running test: testNormalizeNumber ---");
        Value integral = ValueCoercion.normalizeNumber(6.0);
        assertEquals(6L, integral.getValue());
        Value fractional = ValueCoercion.normalizeNumber(2.5);
        assertEquals(2.5, fractional.getValue());
        assertEquals(Double.POSITIVE_INFINITY, ValueCoercion.normalizeNumber(Double.POSITIVE_INFINITY).getValue());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testCompare() {
        System.out.println("--- Running test: testCompare ---");
        assertEquals(0, ValueCoercion.compare(Value.of(2L), Value.of(2.0)));
        assertEquals(0, ValueCoercion.compare(Value.text("10"), Value.of(10L)));
        assertTrue(ValueCoercion.compare(Value.text("apple"), Value.text("banana")) < 0);
        assertTrue(ValueCoercion.compare(Value.text("B"), Value.text("a")) < 0, "文本比较区分大小写");
        // 数值总是排在文本之前
        assertTrue(ValueCoercion.compare(Value.of(1000L), Value.text("abc")) < 0);
        assertTrue(ValueCoercion.compare(Value.text("abc"), Value.of(1000L)) > 0);
        assertEquals(0, ValueCoercion.compare(Value.NULL, Value.text("")));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testNaNIsUnordered() {
        System.out.println("--- Running test: testNaNIsUnordered ---");
        Value nan = Value.of(Double.NaN);
        assertFalse(ValueCoercion.compare(ComparisonOperator.EQUAL, nan, Value.of(1L)));
        assertFalse(ValueCoercion.compare(ComparisonOperator.EQUAL, nan, nan));
        assertFalse(ValueCoercion.compare(ComparisonOperator.LESS_EQUAL, nan, Value.of(1L)));
        assertFalse(ValueCoercion.compare(ComparisonOperator.GREATER_EQUAL, Value.of(1L), nan));
        assertTrue(ValueCoercion.compare(ComparisonOperator.NOT_EQUAL, nan, Value.of(1L)));
        assertTrue(ValueCoercion.compare(ComparisonOperator.LESS, Value.of(1L), Value.of(2L)));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTruthinessAndBlankness() {
        System.out.println("--- Running test: testTruthinessAndBlankness ---");
        assertTrue(ValueCoercion.isTruthy(Value.text("x")));
        assertFalse(ValueCoercion.isTruthy(Value.text("  ")));
        assertFalse(ValueCoercion.isTruthy(Value.of(0L)));
        assertTrue(ValueCoercion.isTruthy(Value.of(-0.5)));
        assertFalse(ValueCoercion.isTruthy(Value.NULL));
        assertFalse(ValueCoercion.isTruthy(Value.sequence(List.of())));
        assertTrue(ValueCoercion.isTruthy(Value.of(LocalDate.of(2024, 1, 1))));

        assertTrue(ValueCoercion.isBlank(Value.NULL));
        assertTrue(ValueCoercion.isBlank(Value.text(" \t")));
        assertTrue(ValueCoercion.isBlank(Value.sequence(List.of())));
        assertFalse(ValueCoercion.isBlank(Value.of(0L)));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testToText() {
        System.out.println("--- Running test: testToText ---");
        assertEquals("", ValueCoercion.toText(Value.NULL));
        assertEquals("7", ValueCoercion.toText(Value.of(7L)));
        assertEquals("2.35", ValueCoercion.toText(Value.of(2.35)));
        assertEquals("0.0000001", ValueCoercion.toText(Value.of(1e-7)));
        assertEquals("TRUE", ValueCoercion.toText(Value.TRUE));
        assertEquals("2024-01-05", ValueCoercion.toText(Value.of(LocalDate.of(2024, 1, 5))));
        assertEquals("10:30:00", ValueCoercion.toText(Value.of(LocalTime.of(10, 30))));
        assertEquals("2024-01-05 10:30:00", ValueCoercion.toText(Value.of(LocalDateTime.of(2024, 1, 5, 10, 30))));
        assertEquals("[a, 1, [b]]", ValueCoercion.toText(Value.from(List.of("a", 1, List.of("b")))));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testToDateTime() {
        System.out.println("--- Running test: testToDateTime ---");
        assertEquals(LocalDateTime.of(2024, 1, 5, 10, 30),
                ValueCoercion.toDateTime(Value.text("2024-01-05T10:30"), FIXED));
        assertEquals(LocalDateTime.of(2024, 1, 5, 10, 30, 15),
                ValueCoercion.toDateTime(Value.text(" 2024-01-05 10:30:15 "), FIXED));
        assertEquals(LocalDateTime.of(2024, 1, 5, 0, 0),
                ValueCoercion.toDateTime(Value.text("2024-01-05"), FIXED));
        assertEquals(LocalDateTime.of(2024, 3, 15, 9, 45),
                ValueCoercion.toDateTime(Value.text("09:45"), FIXED));
        assertEquals(LocalDateTime.of(2024, 3, 15, 18, 0),
                ValueCoercion.toDateTime(Value.of(LocalTime.of(18, 0)), FIXED));

        EvaluationException e = assertThrows(EvaluationException.class,
                () -> ValueCoercion.toDateTime(Value.text("next tuesday"), FIXED));
        assertEquals("Cannot interpret 'next tuesday' as a date/time value.", e.getMessage());
        assertThrows(EvaluationException.class, () -> ValueCoercion.toDateTime(Value.of(45292L), FIXED));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testToInt() {
        System.out.println("--- Running test: testToInt ---");
        assertEquals(2, ValueCoercion.toInt(Value.of(2.9)));
        assertEquals(-2, ValueCoercion.toInt(Value.of(-2.9)));
        assertEquals(3, ValueCoercion.toInt(Value.text("3")));
        assertThrows(EvaluationException.class, () -> ValueCoercion.toInt(Value.of(1e12)));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testLazyValuesAreResolved() {
        System.out.println("--- Running test: testLazyValuesAreResolved ---");
        Value lazy = Value.lazy(() -> "12");
        assertEquals(12d, ValueCoercion.toNumber(lazy));
        assertEquals("12", ValueCoercion.toText(lazy));
        System.out.println("Result: Test PASSED.\n");
    }
}
