package org.csu.formula.compiler;

import org.csu.formula.common.exception.ErrorKind;
import org.csu.formula.common.exception.ParseException;
import org.csu.formula.common.model.Value;
import org.csu.formula.compiler.lexer.Lexer;
import org.csu.formula.compiler.parser.Parser;
import org.csu.formula.compiler.parser.ast.ExpressionNode;
import org.csu.formula.compiler.parser.ast.expression.ComparisonNode;
import org.csu.formula.compiler.parser.ast.expression.ComparisonOperator;
import org.csu.formula.compiler.parser.ast.expression.FunctionCallNode;
import org.csu.formula.compiler.parser.ast.expression.LiteralNode;
import org.csu.formula.compiler.parser.ast.expression.UnaryExpressionNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: Parser 类的单元测试，通过 AST 的文本形式检查结合方式
 */
public class ParserTest {

    private ExpressionNode parse(String formula) {
        System.out.println("Input formula: " + formula);
        ExpressionNode ast = new Parser(new Lexer(formula).tokenize()).parse();
        System.out.println("Generated AST: " + ast);
        return ast;
    }

    @Test
    void testPrecedence() {
        System.out.println("--- Running test: testPrecedence ---");
        assertEquals("(1 + (2 * 3))", parse("1+2*3").toString());
        assertEquals("((1 + 2) * 3)", parse("(1+2)*3").toString());
        assertEquals("((\"a\" & 1) + 2)", parse("\"a\"&1+2").toString());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testPowerIsRightAssociative() {
        System.out.println("--- Running test: testPowerIsRightAssociative ---");
        assertEquals("(2 ^ (3 ^ 2))", parse("2^3^2").toString());
        assertEquals("((8 / 4) / 2)", parse("8/4/2").toString());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testComparisonBindsLoosest() {
        System.out.println("--- Running test: testComparisonBindsLoosest ---");
        ExpressionNode ast = parse("{{a}}+1>=2*3");

        ComparisonNode comparison = assertInstanceOf(ComparisonNode.class, ast);
        assertEquals(ComparisonOperator.GREATER_EQUAL, comparison.operator());
        assertEquals("({{a}} + 1)", comparison.left().toString());
        assertEquals("(2 * 3)", comparison.right().toString());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testComparisonChainingFoldsLeft() {
        System.out.println("--- Running test: testComparisonChainingFoldsLeft ---");
        assertEquals("((1 = 1) = TRUE)", parse("1=1=TRUE").toString());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUnaryMinusBindsTighterThanMultiplication() {
        System.out.println("--- Running test: testUnaryMinusBindsTighterThanMultiplication ---");
        ExpressionNode ast = parse("-{{x}}*2");
        assertEquals("(-{{x}} * 2)", ast.toString());

        ExpressionNode power = parse("-{{x}}^2");
        assertInstanceOf(UnaryExpressionNode.class, power);
        assertEquals("-({{x}} ^ 2)", power.toString());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testFunctionCallNamesAreUpperCased() {
        System.out.println("--- Running test: testFunctionCallNamesAreUpperCased ---");
        FunctionCallNode call = assertInstanceOf(FunctionCallNode.class, parse("textJoin(\"-\", true; {{a}}, now())"));

        assertEquals("TEXTJOIN", call.name());
        assertEquals(4, call.arguments().size());
        assertEquals(new LiteralNode(Value.TRUE), call.arguments().get(1));
        FunctionCallNode now = assertInstanceOf(FunctionCallNode.class, call.arguments().get(3));
        assertTrue(now.arguments().isEmpty());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testBareIdentifierIsRejected() {
        System.out.println("--- Running test: testBareIdentifierIsRejected ---");
        ParseException e = assertThrows(ParseException.class, () -> parse("price * 2"));
        System.out.println("Caught expected exception: " + e.getMessage());
        assertEquals("Unexpected identifier 'price' at position 0. Variables must use {{name}} notation.", e.getMessage());
        assertEquals(ErrorKind.SYNTAX, e.getKind());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSyntaxErrors() {
        System.out.println("--- Running test: testSyntaxErrors ---");
        ParseException trailing = assertThrows(ParseException.class, () -> parse("1 2"));
        assertEquals("Syntax Error at position 2: Expected end of formula, but found '2' (NUMBER)", trailing.getMessage());

        ParseException unclosed = assertThrows(ParseException.class, () -> parse("(1+2"));
        assertTrue(unclosed.getMessage().contains("Expected ')' after expression"));

        ParseException badArgs = assertThrows(ParseException.class, () -> parse("SUM(1 2)"));
        assertTrue(badArgs.getMessage().contains("';' or ')' in function arguments"));

        assertThrows(ParseException.class, () -> parse("1+"));
        assertThrows(ParseException.class, () -> parse("*2"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testNestingDepthIsLimited() {
        System.out.println("--- Running test: testNestingDepthIsLimited ---");
        String deep = "(".repeat(40) + "1" + ")".repeat(40);
        Parser parser = new Parser(new Lexer(deep).tokenize(), 16);

        ParseException e = assertThrows(ParseException.class, parser::parse);
        assertEquals("Formula nesting exceeds the maximum depth of 16", e.getMessage());
        assertEquals("1", parse(deep).toString());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testOperatorChainHeightIsLimited() {
        System.out.println("--- Running test: testOperatorChainHeightIsLimited ---");
        // 1+1+...+1 只有一层括号嵌套，但树高等于操作数个数
        String sixteen = "1" + "+1".repeat(15);
        String seventeen = "1" + "+1".repeat(16);

        assertNotNull(new Parser(new Lexer(sixteen).tokenize(), 16).parse());
        ParseException chain = assertThrows(ParseException.class,
                () -> new Parser(new Lexer(seventeen).tokenize(), 16).parse());
        assertEquals("Formula nesting exceeds the maximum depth of 16", chain.getMessage());

        String nestedCalls = "ABS(".repeat(20) + "1" + ")".repeat(20);
        assertThrows(ParseException.class, () -> new Parser(new Lexer(nestedCalls).tokenize(), 16).parse());
        System.out.println("Result: Test PASSED.\n");
    }
}
