package org.pragmatica.expr;

import org.pragmatica.expr.error.ExpressionError;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a pipeline step - either a value or an {@link ExpressionError}.
 */
public sealed interface Result<T> {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(ExpressionError error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Apply one of the two functions depending on the outcome.
     */
    <R> R fold(Function<? super ExpressionError, ? extends R> onError, Function<? super T, ? extends R> onValue);

    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        return fold(Result::failure, value -> success(mapper.apply(value)));
    }

    default <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        return fold(Result::failure, value -> mapper.apply(value));
    }

    default Result<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T> success) {
            action.accept(success.value());
        }
        return this;
    }

    default Result<T> onFailure(Consumer<? super ExpressionError> action) {
        if (this instanceof Failure<T> failure) {
            action.accept(failure.error());
        }
        return this;
    }

    /**
     * The value of a successful result.
     *
     * @throws IllegalStateException if this is a failure
     */
    T unwrap();

    /**
     * The error of a failed result.
     *
     * @throws IllegalStateException if this is a success
     */
    ExpressionError error();

    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> R fold(Function<? super ExpressionError, ? extends R> onError,
                          Function<? super T, ? extends R> onValue) {
            return onValue.apply(value);
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public ExpressionError error() {
            throw new IllegalStateException("Result is a success: " + value);
        }
    }

    record Failure<T>(ExpressionError error) implements Result<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <R> R fold(Function<? super ExpressionError, ? extends R> onError,
                          Function<? super T, ? extends R> onValue) {
            return onError.apply(error);
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException("Result is a failure: " + error.message());
        }
    }
}
