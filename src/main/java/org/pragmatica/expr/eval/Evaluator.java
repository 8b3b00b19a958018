package org.pragmatica.expr.eval;

import org.pragmatica.expr.Result;
import org.pragmatica.expr.error.ExpressionError.EvaluationError;
import org.pragmatica.expr.tree.BinaryOperator;
import org.pragmatica.expr.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Tree-walking evaluator.
 *
 * <p>Operands and call arguments are evaluated left to right and the first failure stops
 * evaluation. The evaluator holds no per-call state and may be shared between threads.
 */
public final class Evaluator {
    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final FunctionRegistry functions;
    private final EvaluatorConfig config;
    private final Node.Visitor<Result<Long>> visitor = new EvaluatingVisitor();

    private Evaluator(FunctionRegistry functions, EvaluatorConfig config) {
        this.functions = Objects.requireNonNull(functions, "functions");
        this.config = Objects.requireNonNull(config, "config");
    }

    public static Evaluator evaluator() {
        return evaluator(FunctionRegistry.empty(), EvaluatorConfig.DEFAULT);
    }

    public static Evaluator evaluator(FunctionRegistry functions) {
        return evaluator(functions, EvaluatorConfig.DEFAULT);
    }

    public static Evaluator evaluator(FunctionRegistry functions, EvaluatorConfig config) {
        return new Evaluator(functions, config);
    }

    public EvaluatorConfig config() {
        return config;
    }

    /**
     * Reduce the tree to a single number.
     */
    public Result<Long> evaluate(Node root) {
        return root.accept(visitor);
    }

    private Result<Long> applyBinary(BinaryOperator operator, long left, long right) {
        if (config.checkedArithmetic()) {
            try {
                return Result.success(applyExact(operator, left, right));
            } catch (ArithmeticException e) {
                return Result.failure(EvaluationError.ArithmeticOverflow.of(operator, left, right));
            }
        }
        return Result.success(applyWrapping(operator, left, right));
    }

    private long applyExact(BinaryOperator operator, long left, long right) {
        return switch (operator) {
            case ADD -> Math.addExact(left, right);
            case SUBTRACT -> Math.subtractExact(left, right);
            case MULTIPLY -> Math.multiplyExact(left, right);
            case DIVIDE -> {
                if (left == Long.MIN_VALUE && right == -1) {
                    throw new ArithmeticException("long overflow");
                }
                yield divide(left, right);
            }
        };
    }

    private long applyWrapping(BinaryOperator operator, long left, long right) {
        return switch (operator) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> divide(left, right);
        };
    }

    private long divide(long left, long right) {
        return switch (config.division()) {
            case TRUNCATE -> left / right;
            case FLOOR -> Math.floorDiv(left, right);
        };
    }

    private Result<Long> negate(long operand) {
        if (config.checkedArithmetic() && operand == Long.MIN_VALUE) {
            return Result.failure(EvaluationError.ArithmeticOverflow.negation(operand));
        }
        return Result.success(-operand);
    }

    private Result<Long> invoke(String name, ExpressionFunction function, long[] arguments) {
        try {
            return Result.success(function.apply(arguments));
        } catch (Exception e) {
            log.debug("Function {} failed for {} argument(s)", name, arguments.length, e);
            return Result.failure(new EvaluationError.FunctionInvocationFailed(name, e));
        }
    }

    private final class EvaluatingVisitor implements Node.Visitor<Result<Long>> {

        @Override
        public Result<Long> visitInteger(Node.IntegerLiteral node) {
            return Result.success(node.value());
        }

        @Override
        public Result<Long> visitUnary(Node.UnaryOp node) {
            var operand = node.operand().accept(this);
            return switch (node.operator()) {
                case PLUS -> operand;
                case MINUS -> operand.flatMap(Evaluator.this::negate);
            };
        }

        @Override
        public Result<Long> visitBinary(Node.BinaryOp node) {
            var left = node.left().accept(this);
            if (left.isFailure()) {
                return left;
            }
            var right = node.right().accept(this);
            if (right.isFailure()) {
                return right;
            }
            if (node.operator() == BinaryOperator.DIVIDE && right.unwrap() == 0) {
                return Result.failure(new EvaluationError.DivisionByZero());
            }
            return applyBinary(node.operator(), left.unwrap(), right.unwrap());
        }

        @Override
        public Result<Long> visitCall(Node.FunctionCall node) {
            var function = functions.lookup(node.name());
            if (function.isEmpty()) {
                return Result.failure(new EvaluationError.UnknownFunction(node.name()));
            }

            var arguments = new long[node.arguments().size()];
            for (int i = 0; i < arguments.length; i++) {
                var argument = node.arguments().get(i).accept(this);
                if (argument.isFailure()) {
                    return argument;
                }
                arguments[i] = argument.unwrap();
            }

            return invoke(node.name(), function.get(), arguments);
        }
    }
}
