package org.axioms.resolution;

/**
 * 结构之间依赖边的种类。
 */
public enum DependencyKind {
    /** 父结构 */
    EXTENDS,
    /** 参数结构，例如 VectorSpace over Field */
    OVER,
    /** 实现块 where 约束的目标 */
    WHERE,
    /** 嵌套子结构 */
    NESTED
}
