package org.axioms.solvers;

import org.axioms.core.Expression;

/**
 * 将求解器原生的值转换回表达式 AST。求解器类型不会越过公共接口。
 * @param <T> 求解器原生表达式类型
 */
public interface ResultConverter<T> {

    /**
     * @param value 求解器返回的值或项
     * @return 对应的表达式
     */
    Expression toExpression(T value);
}
