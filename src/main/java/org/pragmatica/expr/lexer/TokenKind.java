package org.pragmatica.expr.lexer;

/**
 * Kinds of tokens in expression text.
 */
public enum TokenKind {
    INTEGER("integer"),
    PLUS("'+'"),
    MINUS("'-'"),
    MUL("'*'"),
    DIV("'/'"),
    LPAREN("'('"),
    RPAREN("')'"),
    IDENTIFIER("identifier"),
    COMMA("','"),
    EOF("end of input");

    private final String description;

    TokenKind(String description) {
        this.description = description;
    }

    /**
     * How the kind reads in error messages.
     */
    public String description() {
        return description;
    }
}
