package org.axioms.structures;

/**
 * 结构成员的种类。
 */
public enum MemberKind {
    OPERATION,
    ELEMENT,
    AXIOM,
    NESTED,
    FUNCTION
}
