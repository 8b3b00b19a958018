package org.pragmatica.expr.tree;

import java.util.stream.Collectors;

/**
 * Renders a tree as fully parenthesized text.
 */
final class SourceRenderer implements Node.Visitor<String> {
    static final SourceRenderer INSTANCE = new SourceRenderer();

    private SourceRenderer() {}

    @Override
    public String visitInteger(Node.IntegerLiteral node) {
        // Negative constants only come from hand-built trees
        return node.value() < 0
               ? "(" + node.value() + ")"
               : Long.toString(node.value());
    }

    @Override
    public String visitBinary(Node.BinaryOp node) {
        return "(" + node.left().accept(this) + " " + node.operator().symbol() + " " + node.right().accept(this) + ")";
    }

    @Override
    public String visitUnary(Node.UnaryOp node) {
        return node.operator().symbol() + node.operand().accept(this);
    }

    @Override
    public String visitCall(Node.FunctionCall node) {
        return node.arguments()
                   .stream()
                   .map(argument -> argument.accept(this))
                   .collect(Collectors.joining(", ", node.name() + "(", ")"));
    }
}
