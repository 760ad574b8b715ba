package org.kidoni.cas.lexer;

public enum TokenKind {
    NUMBER,
    VARIABLE,
    FUNCTION,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    LPAREN,
    RPAREN,
    COMMA,
    END,
    INVALID;

    /**
     * True for the tokens that can begin a power term, which is what makes adjacency an implicit
     * multiplication.
     */
    public boolean startsPower() {
        return this == NUMBER || this == VARIABLE || this == FUNCTION || this == LPAREN;
    }
}
