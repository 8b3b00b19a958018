package org.pragmatica.expr.lexer;

import org.pragmatica.expr.tree.SourceLocation;
import org.pragmatica.expr.tree.SourceSpan;

/**
 * Lexical unit of expression text.
 *
 * @param kind  token kind
 * @param text  source text of the token, empty for {@link TokenKind#EOF}
 * @param value parsed value, meaningful for {@link TokenKind#INTEGER} only
 * @param span  where the token was found
 */
public record Token(TokenKind kind, String text, long value, SourceSpan span) {

    public static Token integer(SourceSpan span, String text, long value) {
        return new Token(TokenKind.INTEGER, text, value, span);
    }

    public static Token identifier(SourceSpan span, String name) {
        return new Token(TokenKind.IDENTIFIER, name, 0, span);
    }

    public static Token symbol(TokenKind kind, SourceSpan span, char symbol) {
        return new Token(kind, String.valueOf(symbol), 0, span);
    }

    public static Token eof(SourceLocation location) {
        return new Token(TokenKind.EOF, "", 0, SourceSpan.at(location));
    }

    public SourceLocation location() {
        return span.start();
    }

    public int offset() {
        return span.start().offset();
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    @Override
    public String toString() {
        return kind == TokenKind.EOF
               ? "EOF@" + location()
               : kind + "(" + text + ")@" + location();
    }
}
