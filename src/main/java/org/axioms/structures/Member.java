package org.axioms.structures;

/**
 * 结构体中的成员声明。同一作用域内成员名唯一。
 */
public interface Member {

    String getName();

    MemberKind getKind();
}
