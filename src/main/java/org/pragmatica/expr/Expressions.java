package org.pragmatica.expr;

import org.pragmatica.expr.eval.DivisionPolicy;
import org.pragmatica.expr.eval.EvaluatorConfig;
import org.pragmatica.expr.eval.ExpressionFunction;
import org.pragmatica.expr.eval.FunctionRegistry;
import org.pragmatica.expr.tree.Node;

import java.util.Map;

/**
 * Entry point for evaluating arithmetic expressions.
 *
 * <p>Example usage:
 * <pre>{@code
 * Expressions.evaluate("2 + 3 * 4").unwrap();                       // 14
 *
 * var functions = FunctionRegistry.builder()
 *                                 .function("max", args -> Math.max(args[0], args[1]))
 *                                 .build();
 * Expressions.evaluate("max(10, 20)", functions).unwrap();          // 20
 *
 * var engine = Expressions.builder()
 *                         .division(DivisionPolicy.FLOOR)
 *                         .build();
 * engine.evaluate("-7 / 2").unwrap();                               // -4
 * }</pre>
 */
public final class Expressions {
    private static final ExpressionEngine DEFAULT_ENGINE = ExpressionEngine.create(FunctionRegistry.empty(),
                                                                                   EvaluatorConfig.DEFAULT);

    private Expressions() {}

    /**
     * Evaluate text without any functions available.
     */
    public static Result<Long> evaluate(String expression) {
        return DEFAULT_ENGINE.evaluate(expression);
    }

    /**
     * Evaluate text, resolving calls against the given registry.
     */
    public static Result<Long> evaluate(String expression, FunctionRegistry functions) {
        return ExpressionEngine.create(functions, EvaluatorConfig.DEFAULT)
                               .evaluate(expression);
    }

    /**
     * Evaluate text, resolving calls against the given name to function map.
     */
    public static Result<Long> evaluate(String expression, Map<String, ExpressionFunction> functions) {
        return evaluate(expression, FunctionRegistry.of(functions));
    }

    /**
     * Parse text into a tree without evaluating it.
     */
    public static Result<Node> parse(String expression) {
        return DEFAULT_ENGINE.parse(expression);
    }

    /**
     * Create a builder for an engine with custom functions or configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final FunctionRegistry.Builder functions = FunctionRegistry.builder();
        private FunctionRegistry fallback = FunctionRegistry.empty();
        private DivisionPolicy division = EvaluatorConfig.DEFAULT.division();
        private boolean checkedArithmetic = EvaluatorConfig.DEFAULT.checkedArithmetic();

        private Builder() {}

        public Builder function(String name, ExpressionFunction function) {
            functions.function(name, function);
            return this;
        }

        /**
         * Resolve names not registered through {@link #function} against this registry.
         */
        public Builder functions(FunctionRegistry registry) {
            this.fallback = registry;
            return this;
        }

        public Builder division(DivisionPolicy policy) {
            this.division = policy;
            return this;
        }

        public Builder checkedArithmetic(boolean checked) {
            this.checkedArithmetic = checked;
            return this;
        }

        public ExpressionEngine build() {
            var config = new EvaluatorConfig(division, checkedArithmetic);
            return ExpressionEngine.create(functions.build().orElse(fallback), config);
        }
    }
}
