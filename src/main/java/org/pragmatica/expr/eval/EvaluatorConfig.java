package org.pragmatica.expr.eval;

import java.util.Objects;

/**
 * Evaluation options.
 *
 * @param division          rounding of integer division
 * @param checkedArithmetic fail on 64-bit overflow instead of wrapping around
 */
public record EvaluatorConfig(
    DivisionPolicy division,
    boolean checkedArithmetic
) {
    public static final EvaluatorConfig DEFAULT = new EvaluatorConfig(
        DivisionPolicy.TRUNCATE,
        true
    );

    public EvaluatorConfig {
        Objects.requireNonNull(division, "division");
    }

    public EvaluatorConfig withDivision(DivisionPolicy policy) {
        return new EvaluatorConfig(policy, checkedArithmetic);
    }

    public EvaluatorConfig withCheckedArithmetic(boolean checked) {
        return new EvaluatorConfig(division, checked);
    }
}
