package org.pragmatica.expr.tree;

/**
 * Prefix sign operators.
 */
public enum UnaryOperator {
    PLUS('+'),
    MINUS('-');

    private final char symbol;

    UnaryOperator(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
