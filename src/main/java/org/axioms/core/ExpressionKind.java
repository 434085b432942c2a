package org.axioms.core;

/**
 * 表达式节点的种类，用于在翻译器和转换器中进行分派。
 */
public enum ExpressionKind {
    CONSTANT,
    VARIABLE,
    OPERATION,
    QUANTIFIED,
    CONDITIONAL
}
