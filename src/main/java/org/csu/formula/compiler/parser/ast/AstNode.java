package org.csu.formula.compiler.parser.ast;

/**
 * 所有 AST 节点的标记接口。
 */
public interface AstNode {
}
