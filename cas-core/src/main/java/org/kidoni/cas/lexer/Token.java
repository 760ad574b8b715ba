package org.kidoni.cas.lexer;

public record Token(TokenKind kind, String text, int offset) {
    public boolean is(final TokenKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return kind + "('" + text + "')@" + offset;
    }
}
