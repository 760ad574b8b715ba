package org.kidoni.cas.lexer;

import java.util.ArrayList;
import java.util.List;

import org.kidoni.cas.op.Functions;

import static java.lang.Character.isDigit;
import static java.lang.Character.isLetter;
import static java.lang.Character.isLetterOrDigit;
import static java.lang.Character.isWhitespace;

/**
 * Splits expression text into tokens on demand. The lexer never fails: characters it does not
 * understand come back as {@link TokenKind#INVALID} tokens for the parser to reject.
 */
public class Lexer {
    private final String input;
    private int position;

    public Lexer(final String input) {
        assert input != null;
        this.input = input;
    }

    public Token next() {
        skipWhitespace();

        if (position >= input.length()) {
            return new Token(TokenKind.END, "", position);
        }

        char current = input.charAt(position);
        if (isDigit(current) || current == '.') {
            return readNumber();
        }
        if (isLetter(current) || current == '_') {
            return readIdentifier();
        }

        int start = position++;
        TokenKind kind = switch (current) {
            case '+' -> TokenKind.PLUS;
            case '-' -> TokenKind.MINUS;
            case '*' -> TokenKind.STAR;
            case '/' -> TokenKind.SLASH;
            case '^' -> TokenKind.CARET;
            case '(' -> TokenKind.LPAREN;
            case ')' -> TokenKind.RPAREN;
            case ',' -> TokenKind.COMMA;
            default -> TokenKind.INVALID;
        };
        return new Token(kind, String.valueOf(current), start);
    }

    public void reset() {
        position = 0;
    }

    public int position() {
        return position;
    }

    /**
     * Drains the remaining input, including the closing {@link TokenKind#END} token.
     */
    public List<Token> tokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = next();
            tokens.add(token);
        } while (!token.is(TokenKind.END));
        return tokens;
    }

    private Token readNumber() {
        int start = position;
        boolean seenDecimalPoint = false;

        while (position < input.length()) {
            char c = input.charAt(position);
            if (isDigit(c)) {
                position++;
            }
            else if (c == '.' && !seenDecimalPoint) {
                seenDecimalPoint = true;
                position++;
            }
            else {
                break;
            }
        }

        int exponentEnd = exponentEnd(position);
        if (exponentEnd > position) {
            position = exponentEnd;
        }

        return new Token(TokenKind.NUMBER, input.substring(start, position), start);
    }

    // an 'e' only belongs to the number when digits follow it, so "2e" stays 2 times e
    private int exponentEnd(final int from) {
        int i = from;
        if (i >= input.length() || (input.charAt(i) != 'e' && input.charAt(i) != 'E')) {
            return from;
        }
        i++;
        if (i < input.length() && (input.charAt(i) == '+' || input.charAt(i) == '-')) {
            i++;
        }
        if (i >= input.length() || !isDigit(input.charAt(i))) {
            return from;
        }
        while (i < input.length() && isDigit(input.charAt(i))) {
            i++;
        }
        return i;
    }

    private Token readIdentifier() {
        int start = position;
        while (position < input.length()
                && (isLetterOrDigit(input.charAt(position)) || input.charAt(position) == '_')) {
            position++;
        }

        String identifier = input.substring(start, position);
        TokenKind kind = Functions.isKnown(identifier) ? TokenKind.FUNCTION : TokenKind.VARIABLE;
        return new Token(kind, identifier, start);
    }

    private void skipWhitespace() {
        while (position < input.length() && isWhitespace(input.charAt(position))) {
            position++;
        }
    }
}
