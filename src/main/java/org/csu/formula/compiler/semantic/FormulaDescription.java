package org.csu.formula.compiler.semantic;

import org.csu.formula.compiler.parser.ast.ExpressionNode;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 公式的静态描述: 语法树、引用的变量名和 (大写的) 函数名，两个集合均已排序。
 */
public record FormulaDescription(ExpressionNode ast, Set<String> variables, Set<String> functions) {

    public FormulaDescription {
        variables = Collections.unmodifiableSet(new TreeSet<>(variables));
        functions = Collections.unmodifiableSet(new TreeSet<>(functions));
    }
}
