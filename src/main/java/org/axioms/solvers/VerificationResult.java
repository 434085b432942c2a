package org.axioms.solvers;

import java.util.Objects;
import java.util.Optional;

/**
 * 单次公理验证的结果。
 */
public final class VerificationResult {

    public enum Status {
        /** 公理成立 */
        VALID,
        /** 公理不成立，附反例 */
        INVALID,
        /** 求解器无法判定（含超时） */
        UNKNOWN,
        /** 目标无法翻译或引擎失败 */
        ERROR
    }

    private static final VerificationResult VALID_RESULT = new VerificationResult(Status.VALID, null, null);

    private final Status status;
    private final Counterexample counterexample;
    private final String message;

    private VerificationResult(Status status, Counterexample counterexample, String message) {
        this.status = status;
        this.counterexample = counterexample;
        this.message = message;
    }

    public static VerificationResult valid() {
        return VALID_RESULT;
    }

    public static VerificationResult invalid(Counterexample counterexample) {
        return new VerificationResult(Status.INVALID,
                Objects.requireNonNull(counterexample, "VerificationResult-invalid: counterexample 不能为 null"), null);
    }

    public static VerificationResult unknown(String reason) {
        return new VerificationResult(Status.UNKNOWN, null, reason);
    }

    public static VerificationResult error(String message) {
        return new VerificationResult(Status.ERROR, null, message);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public boolean isInvalid() {
        return status == Status.INVALID;
    }

    public Optional<Counterexample> getCounterexample() {
        return Optional.ofNullable(counterexample);
    }

    /**
     * @return UNKNOWN 的原因或 ERROR 的信息
     */
    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VerificationResult that)) {
            return false;
        }
        return status == that.status && Objects.equals(counterexample, that.counterexample)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, counterexample, message);
    }

    @Override
    public String toString() {
        return switch (status) {
            case VALID -> "Valid";
            case INVALID -> "Invalid{" + counterexample + "}";
            case UNKNOWN -> "Unknown{" + message + "}";
            case ERROR -> "Error{" + message + "}";
        };
    }
}
