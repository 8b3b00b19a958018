package org.pragmatica.expr.error;

import org.pragmatica.expr.lexer.TokenKind;
import org.pragmatica.expr.tree.BinaryOperator;
import org.pragmatica.expr.tree.SourceLocation;

import java.util.Objects;
import java.util.Optional;

/**
 * Reason an expression could not be lexed, parsed or evaluated.
 *
 * <p>Errors are values: every pipeline stage returns them inside a failed
 * {@link org.pragmatica.expr.Result} instead of throwing.
 */
public sealed interface ExpressionError {

    /**
     * Human-readable description.
     */
    String message();

    /**
     * Stable identifier of the error kind, e.g. {@code E0101}.
     */
    String code();

    /**
     * Suggestion for fixing the input, if one applies.
     */
    default Optional<String> help() {
        return Optional.empty();
    }

    /**
     * Where in the source the error was detected, if it is tied to a position.
     */
    default Optional<SourceLocation> location() {
        return Optional.empty();
    }

    /**
     * Input text could not be split into tokens.
     */
    sealed interface LexError extends ExpressionError {
        SourceLocation position();

        @Override
        default Optional<SourceLocation> location() {
            return Optional.of(position());
        }

        record UnexpectedCharacter(SourceLocation position, char character) implements LexError {
            @Override
            public String code() {
                return "E0001";
            }

            @Override
            public String message() {
                return "Unexpected character '" + character + "' at " + position;
            }
        }

        /**
         * Digit run does not fit into a 64-bit signed integer.
         */
        record IntegerOutOfRange(SourceLocation position, String literal) implements LexError {
            @Override
            public String code() {
                return "E0002";
            }

            @Override
            public Optional<String> help() {
                return Optional.of("integer literals must not exceed " + Long.MAX_VALUE);
            }

            @Override
            public String message() {
                return "Integer literal " + literal + " at " + position + " is out of range";
            }
        }
    }

    /**
     * Token sequence does not form an expression.
     */
    sealed interface ParseError extends ExpressionError {
        SourceLocation position();

        @Override
        default Optional<SourceLocation> location() {
            return Optional.of(position());
        }

        record UnexpectedToken(SourceLocation position, String expected, TokenKind found) implements ParseError {
            @Override
            public String code() {
                return "E0101";
            }

            @Override
            public String message() {
                return "Expected " + expected + ", got " + found.description() + " at " + position;
            }
        }

        record BareIdentifier(SourceLocation position, String name) implements ParseError {
            @Override
            public String code() {
                return "E0102";
            }

            @Override
            public Optional<String> help() {
                return Optional.of("call it as a function: " + name + "(...)");
            }

            @Override
            public String message() {
                return "Unexpected identifier '" + name + "' at " + position + ": variables are not supported";
            }
        }

        record TrailingInput(SourceLocation position, TokenKind found) implements ParseError {
            @Override
            public String code() {
                return "E0103";
            }

            @Override
            public Optional<String> help() {
                return Optional.of("an operator may be missing before this token");
            }

            @Override
            public String message() {
                return "Expected end of expression, got " + found.description() + " at " + position;
            }
        }
    }

    /**
     * Well-formed tree could not be reduced to a number.
     */
    sealed interface EvaluationError extends ExpressionError {

        record DivisionByZero() implements EvaluationError {
            @Override
            public String code() {
                return "E0201";
            }

            @Override
            public String message() {
                return "Division by zero";
            }
        }

        record UnknownFunction(String name) implements EvaluationError {
            @Override
            public String code() {
                return "E0202";
            }

            @Override
            public Optional<String> help() {
                return Optional.of("register '" + name + "' in the function registry");
            }

            @Override
            public String message() {
                return "Unknown function: " + name;
            }
        }

        /**
         * Registry function threw while being invoked.
         */
        record FunctionInvocationFailed(String name, Throwable cause) implements EvaluationError {
            public FunctionInvocationFailed {
                Objects.requireNonNull(cause, "cause");
            }

            @Override
            public String code() {
                return "E0203";
            }

            @Override
            public String message() {
                var detail = cause.getMessage() == null
                             ? cause.getClass().getName()
                             : cause.getMessage();
                return "Error calling function " + name + ": " + detail;
            }
        }

        /**
         * Result does not fit into 64 bits under checked arithmetic.
         */
        record ArithmeticOverflow(String operation) implements EvaluationError {
            public static ArithmeticOverflow of(BinaryOperator operator, long left, long right) {
                return new ArithmeticOverflow(left + " " + operator.symbol() + " " + right);
            }

            public static ArithmeticOverflow negation(long operand) {
                return new ArithmeticOverflow("-(" + operand + ")");
            }

            @Override
            public String code() {
                return "E0204";
            }

            @Override
            public Optional<String> help() {
                return Optional.of("results must fit into a 64-bit signed integer");
            }

            @Override
            public String message() {
                return "Arithmetic overflow in " + operation;
            }
        }
    }
}
