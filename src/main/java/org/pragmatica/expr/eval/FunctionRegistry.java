package org.pragmatica.expr.eval;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves function names used in expressions.
 *
 * <p>The evaluator only reads a registry. Registries created by the factories below are
 * immutable and may be shared between threads as long as the functions themselves allow it.
 */
@FunctionalInterface
public interface FunctionRegistry {

    Optional<ExpressionFunction> lookup(String name);

    /**
     * Registry without any functions.
     */
    static FunctionRegistry empty() {
        return name -> Optional.empty();
    }

    /**
     * Registry backed by a copy of the given map.
     */
    static FunctionRegistry of(Map<String, ExpressionFunction> functions) {
        var copy = Map.copyOf(functions);
        return name -> Optional.ofNullable(copy.get(name));
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Registry that consults this one first and {@code fallback} for names it does not know.
     */
    default FunctionRegistry orElse(FunctionRegistry fallback) {
        Objects.requireNonNull(fallback, "fallback");
        return name -> lookup(name).or(() -> fallback.lookup(name));
    }

    final class Builder {
        private final Map<String, ExpressionFunction> functions = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Register a function. A later registration under the same name replaces the earlier one.
         */
        public Builder function(String name, ExpressionFunction function) {
            functions.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(function, "function"));
            return this;
        }

        public Builder functions(Map<String, ExpressionFunction> all) {
            all.forEach(this::function);
            return this;
        }

        public FunctionRegistry build() {
            return of(functions);
        }
    }
}
