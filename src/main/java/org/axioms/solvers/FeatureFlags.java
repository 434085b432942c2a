package org.axioms.solvers;

import lombok.Getter;

/**
 * 后端声明的功能开关，从能力清单 JSON 读取，缺省均为 false。
 */
@Getter
public class FeatureFlags {

    private boolean quantifiers;
    private boolean uninterpretedFunctions;
    private boolean recursiveFunctions;
    private boolean evaluation;
    private boolean simplification;
    private boolean proofGeneration;

    @Override
    public String toString() {
        return "FeatureFlags{quantifiers=" + quantifiers
                + ", uninterpretedFunctions=" + uninterpretedFunctions
                + ", recursiveFunctions=" + recursiveFunctions
                + ", evaluation=" + evaluation
                + ", simplification=" + simplification
                + ", proofGeneration=" + proofGeneration + "}";
    }
}
