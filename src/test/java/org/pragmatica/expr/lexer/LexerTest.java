package org.pragmatica.expr.lexer;

import org.junit.jupiter.api.Test;
import org.pragmatica.expr.error.ExpressionError.LexError;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    @Test
    void tokenize_identifier_producesIdentifierAndEof() {
        var tokens = Lexer.tokenize("max").unwrap();

        assertEquals(2, tokens.size());
        assertEquals(TokenKind.IDENTIFIER, tokens.get(0).kind());
        assertEquals("max", tokens.get(0).text());
        assertEquals(TokenKind.EOF, tokens.get(1).kind());
    }

    @Test
    void tokenize_functionCall_producesAllKinds() {
        var tokens = Lexer.tokenize("max(1,2)").unwrap();

        assertThat(tokens).extracting(Token::kind)
                          .containsExactly(TokenKind.IDENTIFIER,
                                           TokenKind.LPAREN,
                                           TokenKind.INTEGER,
                                           TokenKind.COMMA,
                                           TokenKind.INTEGER,
                                           TokenKind.RPAREN,
                                           TokenKind.EOF);
    }

    @Test
    void tokenize_operators_mapsEachSymbol() {
        var tokens = Lexer.tokenize("+-*/").unwrap();

        assertThat(tokens).extracting(Token::kind)
                          .containsExactly(TokenKind.PLUS, TokenKind.MINUS, TokenKind.MUL, TokenKind.DIV, TokenKind.EOF);
        assertThat(tokens).extracting(Token::text)
                          .containsExactly("+", "-", "*", "/", "");
    }

    @Test
    void tokenize_nestedCalls_keepsIdentifierText() {
        var tokens = Lexer.tokenize("max(min(1, 2), 3)").unwrap();

        assertEquals("max", tokens.get(0).text());
        assertEquals(TokenKind.IDENTIFIER, tokens.get(2).kind());
        assertEquals("min", tokens.get(2).text());
    }

    @Test
    void tokenize_identifierWithUnderscoresAndDigits_isSingleToken() {
        var tokens = Lexer.tokenize("func_name_123 _x").unwrap();

        assertEquals("func_name_123", tokens.get(0).text());
        assertEquals("_x", tokens.get(1).text());
    }

    @Test
    void tokenize_integer_carriesValueAndOffsets() {
        var tokens = Lexer.tokenize("  42 + 7").unwrap();

        var first = tokens.get(0);
        assertEquals(TokenKind.INTEGER, first.kind());
        assertEquals(42L, first.value());
        assertEquals(2, first.offset());
        assertEquals(2, first.span().length());
        assertEquals(5, tokens.get(1).offset());
        assertEquals(7, tokens.get(2).offset());
    }

    @Test
    void tokenize_digitsFollowedByLetters_splitsIntoTwoTokens() {
        var tokens = Lexer.tokenize("12ab").unwrap();

        assertThat(tokens).extracting(Token::kind)
                          .containsExactly(TokenKind.INTEGER, TokenKind.IDENTIFIER, TokenKind.EOF);
    }

    @Test
    void tokenize_whitespaceOnly_producesEof() {
        var tokens = Lexer.tokenize(" \t\n ").unwrap();

        assertEquals(List.of(TokenKind.EOF), tokens.stream().map(Token::kind).toList());
    }

    @Test
    void tokenize_newline_advancesLine() {
        var tokens = Lexer.tokenize("1 +\n  2").unwrap();

        var last = tokens.get(2);
        assertEquals(2, last.location().line());
        assertEquals(3, last.location().column());
        assertEquals(6, last.offset());
    }

    @Test
    void nextToken_afterEnd_keepsReturningEof() {
        var lexer = Lexer.lexer("7");

        assertEquals(TokenKind.INTEGER, lexer.nextToken().unwrap().kind());
        var eof = lexer.nextToken().unwrap();
        assertEquals(TokenKind.EOF, eof.kind());
        assertEquals(eof, lexer.nextToken().unwrap());
        assertEquals(eof, lexer.nextToken().unwrap());
    }

    @Test
    void nextToken_invalidCharacter_failsWithLocation() {
        var lexer = Lexer.lexer("2 + $");

        lexer.nextToken();
        lexer.nextToken();
        var result = lexer.nextToken();

        assertTrue(result.isFailure());
        var error = assertInstanceOf(LexError.UnexpectedCharacter.class, result.error());
        assertEquals('$', error.character());
        assertEquals(4, error.position().offset());
        assertThat(error.message()).contains("'$'").contains("1:5");
    }

    @Test
    void tokenize_invalidCharacter_fails() {
        var result = Lexer.tokenize("1 . 2");

        assertTrue(result.isFailure());
        assertInstanceOf(LexError.UnexpectedCharacter.class, result.error());
    }

    @Test
    void tokenize_largestLong_succeeds() {
        var tokens = Lexer.tokenize("9223372036854775807").unwrap();

        assertEquals(Long.MAX_VALUE, tokens.get(0).value());
    }

    @Test
    void tokenize_integerBeyondLong_fails() {
        var result = Lexer.tokenize("1 + 9223372036854775808");

        var error = assertInstanceOf(LexError.IntegerOutOfRange.class, result.error());
        assertEquals("9223372036854775808", error.literal());
        assertEquals(4, error.position().offset());
    }

    @Test
    void tokenize_leadingZeros_parseAsDecimal() {
        var tokens = Lexer.tokenize("007").unwrap();

        assertEquals(7L, tokens.get(0).value());
        assertEquals("007", tokens.get(0).text());
    }
}
