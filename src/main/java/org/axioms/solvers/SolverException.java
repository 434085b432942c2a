package org.axioms.solvers;

import org.axioms.core.AxiomVerificationException;

/**
 * 求解器层面的失败：超时或引擎内部错误。
 * verify 将其转换为 UNKNOWN/ERROR 结果，其余查询直接抛出。
 */
public class SolverException extends AxiomVerificationException {

    public enum Kind {
        TIMEOUT,
        ENGINE_FAILURE
    }

    private final Kind kind;

    public SolverException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SolverException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
