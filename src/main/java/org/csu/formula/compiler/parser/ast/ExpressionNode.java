package org.csu.formula.compiler.parser.ast;

/**
 * 表达式节点。节点构建后不可变，toString() 输出可重新解析的公式文本。
 */
public interface ExpressionNode extends AstNode {
}
