package org.axioms.symbolic;

import org.axioms.core.AxiomVerificationException;

/**
 * 表达式无法翻译为求解器表达式。按表达式报告，不影响其他结构。
 */
public class TranslationException extends AxiomVerificationException {

    public enum Kind {
        /** 无法表达的构造：自由变量、排序不匹配等 */
        UNSUPPORTED_CONSTRUCT,
        /** 运算名有原生翻译器，但没有匹配的元数 */
        ARITY_MISMATCH
    }

    private final Kind kind;

    public TranslationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static TranslationException unsupported(String message) {
        return new TranslationException(Kind.UNSUPPORTED_CONSTRUCT, message);
    }

    public static TranslationException arityMismatch(String name, int arity, Object expected) {
        return new TranslationException(Kind.ARITY_MISMATCH,
                "运算 " + name + " 不接受 " + arity + " 个参数，支持的元数: " + expected);
    }

    public Kind getKind() {
        return kind;
    }
}
