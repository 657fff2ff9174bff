package org.csu.formula.compiler.parser.ast.expression;

import org.csu.formula.common.model.Value;
import org.csu.formula.compiler.parser.ast.ExpressionNode;

import java.math.BigDecimal;

/**
 * AST 节点: 表示一个字面量 (数字、字符串、布尔值、NULL)
 */
public record LiteralNode(Value value) implements ExpressionNode {

    @Override
    public String toString() {
        return switch (value.getType()) {
            case NULL -> "NULL";
            case BOOLEAN -> value.asBoolean() ? "TRUE" : "FALSE";
            case TEXT -> "\"" + value.asText().replace("\\", "\\\\").replace("\"", "\"\"") + "\"";
            case NUMBER -> value.getValue() instanceof Double d && Double.isFinite(d)
                    ? BigDecimal.valueOf(d).toPlainString()
                    : String.valueOf(value.getValue());
            default -> String.valueOf(value.getValue());
        };
    }
}
