package org.pragmatica.expr.tree;

import java.util.List;
import java.util.Objects;

/**
 * Abstract syntax tree of an arithmetic expression.
 *
 * <p>The set of cases is closed. Code that needs to handle every case goes through
 * {@link Visitor}, so adding a case breaks compilation of every consumer until it
 * handles the new case.
 *
 * <p>Nodes are immutable and compare structurally.
 */
public sealed interface Node {

    <R> R accept(Visitor<R> visitor);

    /**
     * Render the tree as fully parenthesized expression text.
     * For trees produced by the parser the result parses back into an equal tree.
     */
    default String toSource() {
        return accept(SourceRenderer.INSTANCE);
    }

    /**
     * One method per node case.
     */
    interface Visitor<R> {
        R visitInteger(IntegerLiteral node);

        R visitBinary(BinaryOp node);

        R visitUnary(UnaryOp node);

        R visitCall(FunctionCall node);
    }

    static IntegerLiteral integer(long value) {
        return new IntegerLiteral(value);
    }

    static BinaryOp binary(BinaryOperator operator, Node left, Node right) {
        return new BinaryOp(operator, left, right);
    }

    static UnaryOp unary(UnaryOperator operator, Node operand) {
        return new UnaryOp(operator, operand);
    }

    static FunctionCall call(String name, Node... arguments) {
        return new FunctionCall(name, List.of(arguments));
    }

    /**
     * Integer constant. The parser only produces non-negative ones.
     */
    record IntegerLiteral(long value) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInteger(this);
        }
    }

    record BinaryOp(BinaryOperator operator, Node left, Node right) implements Node {
        public BinaryOp {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    record UnaryOp(UnaryOperator operator, Node operand) implements Node {
        public UnaryOp {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    /**
     * Call of a registry function. Arguments keep source order.
     */
    record FunctionCall(String name, List<Node> arguments) implements Node {
        public FunctionCall {
            Objects.requireNonNull(name, "name");
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }
}
