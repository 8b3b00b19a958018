package org.pragmatica.expr.eval;

/**
 * How integer division rounds a non-exact quotient.
 */
public enum DivisionPolicy {
    /**
     * Round toward zero: {@code 7 / 2 == 3}, {@code -7 / 2 == -3}.
     */
    TRUNCATE,

    /**
     * Round toward negative infinity: {@code 7 / 2 == 3}, {@code -7 / 2 == -4}.
     */
    FLOOR
}
