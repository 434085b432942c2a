package org.axioms.core;

import java.util.List;

/**
 * 公理与命题所使用的表达式抽象语法树。
 * 由外部解析器产生，本库只读使用。所有实现均不可变。
 * @see Expressions 构造与遍历的工具方法
 */
public interface Expression {

    /**
     * @return 节点种类
     */
    ExpressionKind getKind();

    /**
     * 返回直接子表达式（按语义顺序）。叶子节点返回空列表。
     * @return 不可变的子表达式列表
     */
    List<Expression> children();
}
