package org.pragmatica.expr.eval;

/**
 * Host-supplied function callable from expressions.
 *
 * <p>Argument count is not checked by the evaluator; an implementation rejects counts
 * it cannot handle by throwing. Any {@link Exception} thrown here, checked or not, is reported as
 * {@link org.pragmatica.expr.error.ExpressionError.EvaluationError.FunctionInvocationFailed}.
 */
@FunctionalInterface
public interface ExpressionFunction {
    /**
     * Compute the function value.
     *
     * @param arguments evaluated call arguments, in source order
     * @return the function value
     */
    long apply(long... arguments);
}
