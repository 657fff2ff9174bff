package org.csu.formula.engine;

import lombok.Getter;
import org.csu.formula.common.exception.ParseException;
import org.csu.formula.common.model.Value;
import org.csu.formula.compiler.lexer.Lexer;
import org.csu.formula.compiler.parser.Parser;
import org.csu.formula.compiler.parser.ast.ExpressionNode;
import org.csu.formula.compiler.semantic.FormulaAnalyzer;
import org.csu.formula.compiler.semantic.FormulaDescription;
import org.csu.formula.function.FormulaFunction;
import org.csu.formula.function.FunctionDescriptor;
import org.csu.formula.function.FunctionRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 公式引擎的统一入口: 词法分析 -> 语法分析 -> 求值。
 * <p>
 * 公式可以带一个前导 '='；空公式 (包括只有 "=") 求值为空文本。
 * 是否把一段文本当作公式由调用方决定，可借助 {@link #looksLikeFormula(String)}。
 */
public class FormulaEngine {

    private static final Pattern FORMULA_PREFIX = Pattern.compile("^\\s*=");

    @Getter
    private final EngineConfig config;
    @Getter
    private final FunctionRegistry registry;
    private final ExpressionEvaluator evaluator;
    private final FormulaAnalyzer analyzer;

    public FormulaEngine() {
        this(EngineConfig.defaults());
    }

    public FormulaEngine(EngineConfig config) {
        this(config, new FunctionRegistry(config));
    }

    public FormulaEngine(EngineConfig config, FunctionRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.evaluator = new ExpressionEvaluator(registry, config.getMaxNestingDepth());
        this.analyzer = new FormulaAnalyzer(registry);
    }

    public Value evaluate(String formula) {
        return evaluate(formula, EvaluationContext.empty());
    }

    public Value evaluate(String formula, Map<String, ?> variables) {
        return evaluate(formula, EvaluationContext.of(variables));
    }

    public Value evaluate(String formula, EvaluationContext context) {
        if (formula == null) {
            return Value.NULL;
        }
        String expression = prepare(formula);
        if (expression.isEmpty()) {
            return Value.EMPTY_TEXT;
        }
        ExpressionNode ast = parseExpression(expression);
        return evaluator.evaluate(ast, context == null ? EvaluationContext.empty() : context);
    }

    public ExpressionNode parse(String formula) {
        String expression = formula == null ? "" : prepare(formula);
        if (expression.isEmpty()) {
            throw new ParseException("Formula is empty.");
        }
        return parseExpression(expression);
    }

    public FormulaDescription describe(String formula) {
        return analyzer.describe(parse(formula));
    }

    /**
     * 检查公式引用的变量都在 variables 中、函数都已注册，缺失时抛出 SemanticException。
     */
    public FormulaDescription validate(String formula, Iterable<String> variables) {
        FormulaDescription description = describe(formula);
        List<String> known = new ArrayList<>();
        variables.forEach(known::add);
        analyzer.validate(description, known);
        return description;
    }

    public void register(String name, FormulaFunction function) {
        registry.register(name, function);
    }

    public void register(FunctionDescriptor descriptor) {
        registry.register(descriptor);
    }

    public boolean unregister(String name) {
        return registry.unregister(name);
    }

    /**
     * 文本是否以 '=' 开头 (允许前导空白)。求值本身不依赖这个判断。
     */
    public static boolean looksLikeFormula(String text) {
        return text != null && FORMULA_PREFIX.matcher(text).find();
    }

    private ExpressionNode parseExpression(String expression) {
        Lexer lexer = new Lexer(expression);
        Parser parser = new Parser(lexer.tokenize(), config.getMaxNestingDepth());
        return parser.parse();
    }

    // 去掉首尾空白和一个前导 '='
    static String prepare(String formula) {
        String trimmed = formula.trim();
        if (trimmed.startsWith("=")) {
            trimmed = trimmed.substring(1).trim();
        }
        return trimmed;
    }
}
