package org.pragmatica.expr.lexer;

import org.pragmatica.expr.Result;
import org.pragmatica.expr.error.ExpressionError.LexError;
import org.pragmatica.expr.tree.SourceLocation;
import org.pragmatica.expr.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits expression text into tokens on demand.
 *
 * <p>Each call to {@link #nextToken()} scans forward from the current position; consumed
 * characters are never revisited. Once the end of input is reached every further call
 * returns an EOF token at the same location.
 *
 * <p>Instances are single-use and not thread-safe.
 */
public final class Lexer {
    private final String input;
    private SourceLocation cursor;

    private Lexer(String input) {
        this.input = Objects.requireNonNull(input, "input");
        this.cursor = SourceLocation.START;
    }

    public static Lexer lexer(String input) {
        return new Lexer(input);
    }

    /**
     * Scan the whole input. The returned list ends with the EOF token.
     */
    public static Result<List<Token>> tokenize(String input) {
        return new Lexer(input).tokenizeAll();
    }

    private Result<List<Token>> tokenizeAll() {
        var tokens = new ArrayList<Token>();
        while (true) {
            var next = nextToken();
            if (next.isFailure()) {
                return Result.failure(next.error());
            }
            var token = next.unwrap();
            tokens.add(token);
            if (token.is(TokenKind.EOF)) {
                return Result.success(List.copyOf(tokens));
            }
        }
    }

    /**
     * Produce the next token, skipping whitespace.
     */
    public Result<Token> nextToken() {
        skipWhitespace();
        if (isAtEnd()) {
            return Result.success(Token.eof(cursor));
        }

        var start = cursor;
        char c = peek();
        if (isDigit(c)) {
            return scanInteger(start);
        }
        if (isIdentifierStart(c)) {
            return Result.success(scanIdentifier(start));
        }
        return scanSymbol(start);
    }

    private Result<Token> scanInteger(SourceLocation start) {
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
        var span = SourceSpan.of(start, cursor);
        var text = span.extract(input);
        try {
            return Result.success(Token.integer(span, text, Long.parseLong(text)));
        } catch (NumberFormatException e) {
            // Only digits were collected, so the run is too long for a long
            return Result.failure(new LexError.IntegerOutOfRange(start, text));
        }
    }

    private Token scanIdentifier(SourceLocation start) {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        var span = SourceSpan.of(start, cursor);
        return Token.identifier(span, span.extract(input));
    }

    private Result<Token> scanSymbol(SourceLocation start) {
        char c = peek();
        var kind = symbolKind(c);
        if (kind == null) {
            return Result.failure(new LexError.UnexpectedCharacter(start, c));
        }
        advance();
        return Result.success(Token.symbol(kind, SourceSpan.of(start, cursor), c));
    }

    private static TokenKind symbolKind(char c) {
        return switch (c) {
            case '+' -> TokenKind.PLUS;
            case '-' -> TokenKind.MINUS;
            case '*' -> TokenKind.MUL;
            case '/' -> TokenKind.DIV;
            case '(' -> TokenKind.LPAREN;
            case ')' -> TokenKind.RPAREN;
            case ',' -> TokenKind.COMMA;
            default -> null;
        };
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private boolean isAtEnd() {
        return cursor.offset() >= input.length();
    }

    private char peek() {
        return input.charAt(cursor.offset());
    }

    private void advance() {
        cursor = cursor.advance(peek());
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
