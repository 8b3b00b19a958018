package org.pragmatica.expr;

import org.pragmatica.expr.eval.Evaluator;
import org.pragmatica.expr.eval.EvaluatorConfig;
import org.pragmatica.expr.eval.FunctionRegistry;
import org.pragmatica.expr.parser.Parser;
import org.pragmatica.expr.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates expression text against a fixed registry and configuration.
 *
 * <p>Immutable; one engine can serve concurrent callers provided its functions can.
 */
public final class ExpressionEngine {
    private static final Logger log = LoggerFactory.getLogger(ExpressionEngine.class);

    private final Evaluator evaluator;

    private ExpressionEngine(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    static ExpressionEngine create(FunctionRegistry functions, EvaluatorConfig config) {
        return new ExpressionEngine(Evaluator.evaluator(functions, config));
    }

    public EvaluatorConfig config() {
        return evaluator.config();
    }

    /**
     * Parse text into a tree without evaluating it.
     */
    public Result<Node> parse(String expression) {
        return Parser.parse(expression)
                     .onFailure(error -> log.debug("Failed to parse '{}': {}", expression, error.message()));
    }

    /**
     * Parse and evaluate text.
     */
    public Result<Long> evaluate(String expression) {
        return Parser.parse(expression)
                     .flatMap(evaluator::evaluate)
                     .onFailure(error -> log.debug("Failed to evaluate '{}': {}", expression, error.message()));
    }

    /**
     * Evaluate an already parsed tree.
     */
    public Result<Long> evaluate(Node root) {
        return evaluator.evaluate(root);
    }
}
