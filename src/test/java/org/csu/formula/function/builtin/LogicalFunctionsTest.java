package org.csu.formula.function.builtin;

import org.csu.formula.common.exception.EvaluationException;
import org.csu.formula.common.model.Value;
import org.csu.formula.engine.FormulaEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LogicalFunctionsTest {

    private FormulaEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FormulaEngine();
    }

    private Value eval(String formula) {
        Value result = engine.evaluate(formula);
        System.out.println(formula + "  =>  " + result);
        return result;
    }

    private String error(String formula) {
        EvaluationException e = assertThrows(EvaluationException.class, () -> eval(formula));
        System.out.println(formula + "  =>  ERROR: " + e.getMessage());
        return e.getMessage();
    }

    @Test
    void testIf() {
        System.out.println("--- Running test: testIf ---");
        assertEquals(Value.text("yes"), eval("=IF(1>0;\"yes\";\"no\")"));
        assertEquals(Value.NULL, eval("=IF(0;\"yes\")"));
        assertEquals(Value.of(2L), eval("=IF(\"  \";1;2)"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testIfs() {
        System.out.println("--- Running test: testIfs ---");
        assertEquals(Value.of(2L), eval("=IFS(FALSE;1;TRUE;2)"));
        assertEquals("IFS requires condition/value pairs.", error("=IFS(TRUE;1;FALSE)"));
        assertEquals("IFS did not match any condition.", error("=IFS(FALSE;1)"));
        assertEquals("Function 'IFS' expects at least 2 arguments but got 1.", error("=IFS(TRUE)"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSwitch() {
        System.out.println("--- Running test: testSwitch ---");
        assertEquals(Value.text("two"), eval("=SWITCH(2;1;\"one\";2;\"two\")"));
        assertEquals(Value.text("other"), eval("=SWITCH(3;1;\"one\";\"other\")"));
        assertEquals(Value.text("num"), eval("=SWITCH(2;2.0;\"num\")"));
        // 文本 "1" 与数值 1 不是同一个 case
        assertEquals(Value.text("none"), eval("=SWITCH(1;\"1\";\"text\";\"none\")"));
        assertEquals(Value.text("only"), eval("=SWITCH(1;\"only\")"));
        // 布尔值与数值按数值匹配
        assertEquals(Value.text("y"), eval("=SWITCH(TRUE;1;\"y\";\"n\")"));
        assertEquals(Value.text("zero"), eval("=SWITCH(0;FALSE;\"zero\";\"n\")"));
        assertEquals(Value.text("n"), eval("=SWITCH(TRUE;\"TRUE\";\"y\";\"n\")"));
        assertEquals("SWITCH did not match any case.", error("=SWITCH(3;1;\"one\")"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testAndOrNot() {
        System.out.println("--- Running test: testAndOrNot ---");
        assertEquals(Value.TRUE, eval("=AND(1;\"x\";TRUE)"));
        assertEquals(Value.FALSE, eval("=AND(1;0)"));
        assertEquals(Value.TRUE, eval("=AND()"));
        assertEquals(Value.FALSE, eval("=OR()"));
        assertEquals(Value.TRUE, eval("=OR(0;\"\";\"a\")"));
        assertEquals(Value.TRUE, eval("=NOT(\"\")"));
        assertEquals(Value.FALSE, eval("=NOT(5)"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTypePredicates() {
        System.out.println("--- Running test: testTypePredicates ---");
        assertEquals(Value.TRUE, eval("=ISNUMBER(\"12\")"));
        assertEquals(Value.FALSE, eval("=ISNUMBER(\"abc\")"));
        assertEquals(Value.TRUE, eval("=ISNUMBER(NULL)"));
        assertEquals(Value.TRUE, eval("=ISTEXT(\"\")"));
        assertEquals(Value.FALSE, eval("=ISTEXT(1)"));
        assertEquals(Value.TRUE, eval("=ISBLANK(NULL)"));
        assertEquals(Value.TRUE, eval("=ISBLANK(\" \")"));
        assertEquals(Value.FALSE, eval("=ISBLANK(0)"));
        System.out.println("Result: Test PASSED.\n");
    }
}
