package org.csu.formula.cli;

import org.csu.formula.cli.tool.ValuePrinter;
import org.csu.formula.common.exception.FormulaException;
import org.csu.formula.common.model.Value;
import org.csu.formula.compiler.semantic.FormulaDescription;
import org.csu.formula.engine.EngineConfig;
import org.csu.formula.engine.EvaluationContext;
import org.csu.formula.engine.FormulaEngine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 交互式公式控制台。
 * <pre>
 *   :set name = &lt;formula&gt;   求值并绑定到变量
 *   :vars                     列出已绑定的变量
 *   :describe &lt;formula&gt;     列出公式引用的变量和函数
 *   exit                      退出
 * </pre>
 * 其它输入按公式求值并打印结果；出错时打印 "ERROR: ..." 并继续。
 */
public class FormulaShell {

    private static final String PROMPT = "formula> ";

    private final FormulaEngine engine;
    private final BufferedReader in;
    private final PrintWriter out;
    private final Map<String, Value> variables = new LinkedHashMap<>();

    public FormulaShell(FormulaEngine engine, Reader in, Writer out) {
        this.engine = engine;
        this.in = in instanceof BufferedReader br ? br : new BufferedReader(in);
        this.out = out instanceof PrintWriter pw ? pw : new PrintWriter(out, true);
    }

    public static void main(String[] args) {
        EngineConfig config = EngineConfig.defaults();
        for (String arg : args) {
            if ("--verbose".equals(arg)) {
                config.setVerbose(true);
            }
        }
        FormulaShell shell = new FormulaShell(new FormulaEngine(config),
                new InputStreamReader(System.in, StandardCharsets.UTF_8),
                new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        shell.run();
    }

    public void run() {
        out.println("Formula shell. Type 'exit' to quit.");
        try {
            while (true) {
                out.print(PROMPT);
                out.flush();
                String line = in.readLine();
                if (line == null) {
                    break;
                }
                String command = line.trim();
                if (command.isEmpty()) {
                    continue;
                }
                if (command.equalsIgnoreCase("exit") || command.equalsIgnoreCase("exit;")) {
                    break;
                }
                try {
                    out.println(execute(command));
                } catch (FormulaException | IllegalArgumentException e) {
                    out.println("ERROR: " + e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from console", e);
        }
        out.println("Bye!");
        out.flush();
    }

    /**
     * 执行一行命令并返回要打印的文本。
     */
    public String execute(String command) {
        if (command.startsWith(":set")) {
            return set(command.substring(":set".length()));
        }
        if (command.equals(":vars")) {
            return listVariables();
        }
        if (command.startsWith(":describe")) {
            return describe(command.substring(":describe".length()).trim());
        }
        return ValuePrinter.format(engine.evaluate(command, context()));
    }

    public Map<String, Value> getVariables() {
        return variables;
    }

    private String set(String definition) {
        int eq = definition.indexOf('=');
        String name = eq < 0 ? "" : definition.substring(0, eq).trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Usage: :set name = <formula>");
        }
        Value value = engine.evaluate(definition.substring(eq + 1), context());
        variables.put(name, value);
        return name + " = " + ValuePrinter.format(value);
    }

    private String listVariables() {
        if (variables.isEmpty()) {
            return "(no variables)";
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Value> entry : variables.entrySet()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(entry.getKey()).append(" = ").append(ValuePrinter.format(entry.getValue()));
        }
        return sb.toString();
    }

    private String describe(String formula) {
        FormulaDescription description = engine.describe(formula);
        return "ast: " + description.ast() + "\n"
                + "variables: " + String.join(", ", description.variables()) + "\n"
                + "functions: " + String.join(", ", description.functions());
    }

    private EvaluationContext context() {
        return EvaluationContext.of(variables);
    }
}
