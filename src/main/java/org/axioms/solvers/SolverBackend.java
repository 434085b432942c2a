package org.axioms.solvers;

import org.axioms.core.BoundVariable;
import org.axioms.core.Expression;

import java.util.List;
import java.util.Map;

/**
 * 具体 SMT 引擎的封装。所有输入输出都是表达式 AST，求解器原生类型不会出现在此接口上。
 * 实现持有可变的求解器状态，非线程安全。
 */
public interface SolverBackend extends AutoCloseable {

    String name();

    SolverCapabilities capabilities();

    /**
     * 验证命题在当前背景断言下成立。
     * 在临时作用域中断言其否定并检查，无论结果如何都会弹出作用域。
     * @param axiom 待证命题
     * @return VALID、INVALID（附反例）、UNKNOWN 或 ERROR
     */
    VerificationResult verifyAxiom(Expression axiom);

    /**
     * 检查命题与当前背景断言是否同时可满足。
     * @throws SolverException 引擎失败
     */
    SatisfiabilityResult checkSatisfiability(Expression proposition);

    /**
     * 判断两个表达式在当前背景断言下是否恒等。
     * @throws SolverException 求解器无法判定
     */
    boolean areEquivalent(Expression left, Expression right);

    /**
     * 代入绑定后求值并化简。
     * @param expression 表达式
     * @param bindings 变量名 → 取值
     * @return 结果表达式
     */
    Expression evaluate(Expression expression, Map<String, Expression> bindings);

    Expression simplify(Expression expression);

    /**
     * 在当前作用域中断言一个封闭命题。
     * @throws org.axioms.symbolic.TranslationException 命题无法翻译
     */
    void assertExpression(Expression proposition);

    /**
     * 断言派生运算的定义 ∀params. name(params) = body。
     */
    void defineFunction(String name, List<BoundVariable> parameters, Expression body);

    /**
     * 令继承结构的载体参数与被继承结构的载体参数共用同一排序。
     * 已绑定的别名与内置类型名保持不变。
     * @param alias 继承方的类型参数名
     * @param carrier 被继承方的类型参数名
     */
    void declareCarrierAlias(String alias, String carrier);

    /**
     * 声明（或复用）特殊元素对应的具名常量。
     * @param name 元素名
     * @param type 类型名，可为 null
     */
    void declareSpecialElement(String name, String type);

    void push();

    /**
     * @throws IllegalStateException 没有可弹出的作用域
     */
    void pop();

    int scopeDepth();

    /**
     * 丢弃全部断言与已声明的符号。
     */
    void reset();

    /**
     * 检查当前背景断言本身是否可满足。
     */
    SatisfiabilityResult checkConsistency();

    /**
     * @return 已声明的未解释函数个数
     */
    int declaredOperationCount();

    @Override
    void close();
}
