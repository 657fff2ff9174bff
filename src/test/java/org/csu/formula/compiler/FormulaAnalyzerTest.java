package org.csu.formula.compiler;

import org.csu.formula.common.exception.ErrorKind;
import org.csu.formula.common.exception.SemanticException;
import org.csu.formula.compiler.lexer.Lexer;
import org.csu.formula.compiler.parser.Parser;
import org.csu.formula.compiler.semantic.FormulaAnalyzer;
import org.csu.formula.compiler.semantic.FormulaDescription;
import org.csu.formula.function.FunctionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaAnalyzerTest {

    private FormulaAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new FormulaAnalyzer(new FunctionRegistry());
    }

    private FormulaDescription describe(String formula) {
        FormulaDescription description = analyzer.describe(new Parser(new Lexer(formula).tokenize()).parse());
        System.out.println("Description of " + formula + ": variables=" + description.variables()
                + ", functions=" + description.functions());
        return description;
    }

    @Test
    void testCollectsVariablesAndFunctions() {
        System.out.println("--- Running test: testCollectsVariablesAndFunctions ---");
        FormulaDescription description = describe("IF({{a}}>0;SUM({{a}};{{b}});0)");

        assertEquals(Set.of("a", "b"), description.variables());
        assertEquals(List.of("IF", "SUM"), List.copyOf(description.functions()));
        assertEquals("IF(({{a}} > 0); SUM({{a}}; {{b}}); 0)", description.ast().toString());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testWalksEveryNodeKind() {
        System.out.println("--- Running test: testWalksEveryNodeKind ---");
        FormulaDescription description = describe("-{{x}} & lower({{y}}) = {{z}}^2");

        assertEquals(List.of("x", "y", "z"), List.copyOf(description.variables()));
        assertEquals(Set.of("LOWER"), description.functions());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testLiteralHasNoReferences() {
        System.out.println("--- Running test: testLiteralHasNoReferences ---");
        FormulaDescription description = describe("\"plain\"");
        assertTrue(description.variables().isEmpty());
        assertTrue(description.functions().isEmpty());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testValidateAcceptsKnownReferences() {
        System.out.println("--- Running test: testValidateAcceptsKnownReferences ---");
        FormulaDescription description = describe("TEXTJOIN(\" \"; TRUE; {{brand}}; {{model}})");
        assertDoesNotThrow(() -> analyzer.validate(description, List.of("brand", "model", "unused")));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testValidateReportsEveryMissingReference() {
        System.out.println("--- Running test: testValidateReportsEveryMissingReference ---");
        FormulaDescription description = describe("FOO({{b}}) + BAR({{a}}) + SUM({{c}})");

        SemanticException e = assertThrows(SemanticException.class,
                () -> analyzer.validate(description, List.of("c")));
        System.out.println("Caught expected exception: " + e.getMessage());
        assertEquals("Unknown variables: a, b. Unknown functions: BAR, FOO.", e.getMessage());
        assertEquals(ErrorKind.EVALUATION, e.getKind());
        System.out.println("Result: Test PASSED.\n");
    }
}
