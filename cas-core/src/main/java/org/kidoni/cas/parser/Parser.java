package org.kidoni.cas.parser;

import java.util.ArrayList;
import java.util.List;

import org.kidoni.cas.ast.Node;
import org.kidoni.cas.error.ParseException;
import org.kidoni.cas.lexer.Lexer;
import org.kidoni.cas.lexer.Token;
import org.kidoni.cas.lexer.TokenKind;
import org.kidoni.cas.op.BinaryOp;
import org.kidoni.cas.op.UnaryOp;

/**
 * Recursive descent parser for arithmetic expressions with one token of lookahead.
 * <p>
 * Grammar, lowest precedence first:
 * <pre>
 *  Expression: Term (('+' | '-') Term)*
 *  Term:       Power (('*' | '/')? Power)*
 *  Power:      Primary ('^' Power)?
 *  Primary:    Number | Variable
 *            | Function '(' (Expression (',' Expression)*)? ')'
 *            | '(' Expression ')'
 *            | ('+' | '-') Primary
 * </pre>
 * Two powers written next to each other ({@code 2x}, {@code x sin(x)}) multiply. Exponentiation
 * associates to the right, and a leading sign binds tighter than any binary operator.
 */
public class Parser {
    private final Lexer lexer;
    private Token current;

    public Parser(final String input) {
        this(new Lexer(input));
    }

    public Parser(final Lexer lexer) {
        assert lexer != null;
        this.lexer = lexer;
    }

    public Node parse() {
        lexer.reset();
        advance();

        Node expression = parseExpression();
        if (!current.is(TokenKind.END)) {
            throw new ParseException("unexpected trailing input '" + current.text() + "'", current.offset());
        }
        return expression;
    }

    private Node parseExpression() {
        Node left = parseTerm();

        while (current.is(TokenKind.PLUS) || current.is(TokenKind.MINUS)) {
            BinaryOp op = current.is(TokenKind.PLUS) ? BinaryOp.ADD : BinaryOp.SUB;
            advance();
            left = new Node.BinaryNode(op, left, parseTerm());
        }

        return left;
    }

    private Node parseTerm() {
        Node left = parsePower();

        while (current.is(TokenKind.STAR) || current.is(TokenKind.SLASH) || current.kind().startsPower()) {
            BinaryOp op = BinaryOp.MUL;
            if (current.is(TokenKind.SLASH)) {
                op = BinaryOp.DIV;
                advance();
            }
            else if (current.is(TokenKind.STAR)) {
                advance();
            }
            left = new Node.BinaryNode(op, left, parsePower());
        }

        return left;
    }

    private Node parsePower() {
        Node base = parsePrimary();

        if (current.is(TokenKind.CARET)) {
            advance();
            return new Node.BinaryNode(BinaryOp.POW, base, parsePower());
        }

        return base;
    }

    private Node parsePrimary() {
        Token token = current;

        return switch (token.kind()) {
            case NUMBER -> {
                advance();
                yield new Node.ConstNode(parseNumber(token));
            }
            case VARIABLE -> {
                advance();
                yield new Node.VarNode(token.text());
            }
            case FUNCTION -> parseCall();
            case LPAREN -> {
                advance();
                Node inner = parseExpression();
                expect(TokenKind.RPAREN, "expected ')'");
                yield inner;
            }
            case PLUS, MINUS -> {
                advance();
                UnaryOp op = token.is(TokenKind.PLUS) ? UnaryOp.PLUS : UnaryOp.NEGATE;
                yield new Node.UnaryNode(op, parsePrimary());
            }
            case END -> throw new ParseException("unexpected end of input", token.offset());
            case INVALID -> throw new ParseException("invalid character '" + token.text() + "'", token.offset());
            default -> throw new ParseException("unexpected token '" + token.text() + "'", token.offset());
        };
    }

    private Node parseCall() {
        String name = current.text();
        advance();
        expect(TokenKind.LPAREN, "expected '(' after function " + name);

        List<Node> arguments = new ArrayList<>();
        if (!current.is(TokenKind.RPAREN)) {
            arguments.add(parseExpression());
            while (current.is(TokenKind.COMMA)) {
                advance();
                arguments.add(parseExpression());
            }
        }

        expect(TokenKind.RPAREN, "expected ')' to close call to " + name);
        return new Node.CallNode(name, arguments);
    }

    private double parseNumber(final Token token) {
        try {
            return Double.parseDouble(token.text());
        }
        catch (NumberFormatException e) {
            throw new ParseException("malformed number '" + token.text() + "'", token.offset(), e);
        }
    }

    private void expect(final TokenKind kind, final String message) {
        if (!current.is(kind)) {
            throw new ParseException(message, current.offset());
        }
        advance();
    }

    private void advance() {
        current = lexer.next();
    }
}
