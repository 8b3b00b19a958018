package org.pragmatica.expr.parser;

import org.pragmatica.expr.Result;
import org.pragmatica.expr.error.ExpressionError.ParseError;
import org.pragmatica.expr.lexer.Lexer;
import org.pragmatica.expr.lexer.Token;
import org.pragmatica.expr.lexer.TokenKind;
import org.pragmatica.expr.tree.BinaryOperator;
import org.pragmatica.expr.tree.Node;
import org.pragmatica.expr.tree.UnaryOperator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent parser for arithmetic expressions.
 *
 * <p>Grammar, lowest precedence first:
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := factor (('*' | '/') factor)*
 * factor     := ('+' | '-') factor
 *             | INTEGER
 *             | IDENTIFIER '(' arguments ')'
 *             | '(' expression ')'
 * arguments  := (expression (',' expression)*)?
 * </pre>
 *
 * <p>A parser pulls tokens from its lexer one at a time and can be used once.
 */
public final class Parser {
    private static final String OPERAND = "expression";

    private final Lexer lexer;
    private Token current;
    private boolean used;

    private Parser(Lexer lexer) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
    }

    public static Parser parser(Lexer lexer) {
        return new Parser(lexer);
    }

    public static Parser parser(String input) {
        return new Parser(Lexer.lexer(input));
    }

    /**
     * Parse the whole input into a single tree.
     */
    public static Result<Node> parse(String input) {
        return parser(input).parse();
    }

    /**
     * Parse the token stream into a tree. The expression must be followed by end of input.
     *
     * @throws IllegalStateException if this parser has already been used
     */
    public Result<Node> parse() {
        if (used) {
            throw new IllegalStateException("Parser instances are single-use");
        }
        used = true;

        return advance().flatMap(first -> parseExpression())
                        .flatMap(this::requireEnd);
    }

    private Result<Node> requireEnd(Node root) {
        if (!current.is(TokenKind.EOF)) {
            return Result.failure(new ParseError.TrailingInput(current.location(), current.kind()));
        }
        return Result.success(root);
    }

    private Result<Node> parseExpression() {
        var first = parseTerm();
        if (first.isFailure()) {
            return first;
        }
        var node = first.unwrap();

        while (current.is(TokenKind.PLUS) || current.is(TokenKind.MINUS)) {
            var operator = current.is(TokenKind.PLUS)
                           ? BinaryOperator.ADD
                           : BinaryOperator.SUBTRACT;
            var skipped = advance();
            if (skipped.isFailure()) {
                return Result.failure(skipped.error());
            }
            var right = parseTerm();
            if (right.isFailure()) {
                return right;
            }
            node = Node.binary(operator, node, right.unwrap());
        }

        return Result.success(node);
    }

    private Result<Node> parseTerm() {
        var first = parseFactor();
        if (first.isFailure()) {
            return first;
        }
        var node = first.unwrap();

        while (current.is(TokenKind.MUL) || current.is(TokenKind.DIV)) {
            var operator = current.is(TokenKind.MUL)
                           ? BinaryOperator.MULTIPLY
                           : BinaryOperator.DIVIDE;
            var skipped = advance();
            if (skipped.isFailure()) {
                return Result.failure(skipped.error());
            }
            var right = parseFactor();
            if (right.isFailure()) {
                return right;
            }
            node = Node.binary(operator, node, right.unwrap());
        }

        return Result.success(node);
    }

    private Result<Node> parseFactor() {
        var token = current;

        switch (token.kind()) {
            case PLUS:
                return expect(TokenKind.PLUS).flatMap(sign -> parseFactor())
                                             .map(operand -> Node.unary(UnaryOperator.PLUS, operand));
            case MINUS:
                return expect(TokenKind.MINUS).flatMap(sign -> parseFactor())
                                              .map(operand -> Node.unary(UnaryOperator.MINUS, operand));
            case INTEGER:
                return expect(TokenKind.INTEGER).map(literal -> Node.integer(literal.value()));
            case IDENTIFIER:
                return parseCall(token);
            case LPAREN:
                return expect(TokenKind.LPAREN).flatMap(open -> parseExpression())
                                               .flatMap(inner -> expect(TokenKind.RPAREN).map(close -> inner));
            default:
                return Result.failure(new ParseError.UnexpectedToken(token.location(), OPERAND, token.kind()));
        }
    }

    private Result<Node> parseCall(Token name) {
        var skipped = advance();
        if (skipped.isFailure()) {
            return Result.failure(skipped.error());
        }
        if (!current.is(TokenKind.LPAREN)) {
            return Result.failure(new ParseError.BareIdentifier(name.location(), name.text()));
        }
        return expect(TokenKind.LPAREN).flatMap(open -> parseArguments())
                                       .map(arguments -> (Node) new Node.FunctionCall(name.text(), arguments));
    }

    private Result<List<Node>> parseArguments() {
        var arguments = new ArrayList<Node>();

        if (!current.is(TokenKind.RPAREN)) {
            while (true) {
                var argument = parseExpression();
                if (argument.isFailure()) {
                    return Result.failure(argument.error());
                }
                arguments.add(argument.unwrap());

                if (!current.is(TokenKind.COMMA)) {
                    break;
                }
                var skipped = advance();
                if (skipped.isFailure()) {
                    return Result.failure(skipped.error());
                }
            }
        }

        return expect(TokenKind.RPAREN).map(close -> arguments);
    }

    /**
     * Consume the current token if it has the expected kind.
     */
    private Result<Token> expect(TokenKind kind) {
        if (!current.is(kind)) {
            return Result.failure(new ParseError.UnexpectedToken(current.location(),
                                                                 kind.description(),
                                                                 current.kind()));
        }
        var consumed = current;
        return advance().map(next -> consumed);
    }

    private Result<Token> advance() {
        return lexer.nextToken()
                    .onSuccess(token -> current = token);
    }
}
