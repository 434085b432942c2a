package org.axioms.solvers;

import java.util.Objects;
import java.util.Optional;

/**
 * 可满足性检查的结果。可满足时附见证（查询中自由变量的取值）。
 */
public final class SatisfiabilityResult {

    public enum Status {
        SATISFIABLE,
        UNSATISFIABLE,
        UNKNOWN
    }

    private static final SatisfiabilityResult UNSAT = new SatisfiabilityResult(Status.UNSATISFIABLE, null, null);

    private final Status status;
    private final Counterexample witness;
    private final String reason;

    private SatisfiabilityResult(Status status, Counterexample witness, String reason) {
        this.status = status;
        this.witness = witness;
        this.reason = reason;
    }

    public static SatisfiabilityResult satisfiable(Counterexample witness) {
        return new SatisfiabilityResult(Status.SATISFIABLE,
                Objects.requireNonNull(witness, "SatisfiabilityResult-satisfiable: witness 不能为 null"), null);
    }

    public static SatisfiabilityResult unsatisfiable() {
        return UNSAT;
    }

    public static SatisfiabilityResult unknown(String reason) {
        return new SatisfiabilityResult(Status.UNKNOWN, null, reason);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSatisfiable() {
        return status == Status.SATISFIABLE;
    }

    public boolean isUnsatisfiable() {
        return status == Status.UNSATISFIABLE;
    }

    public Optional<Counterexample> getWitness() {
        return Optional.ofNullable(witness);
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return switch (status) {
            case SATISFIABLE -> "Satisfiable{" + witness + "}";
            case UNSATISFIABLE -> "Unsatisfiable";
            case UNKNOWN -> "Unknown{" + reason + "}";
        };
    }
}
