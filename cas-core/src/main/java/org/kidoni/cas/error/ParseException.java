package org.kidoni.cas.error;

public class ParseException extends ExpressionException {
    public ParseException(final String message, final int offset) {
        super(new CasError.ParseError(message, offset));
    }

    public ParseException(final String message, final int offset, final Throwable cause) {
        super(new CasError.ParseError(message, offset), cause);
    }

    public int getOffset() {
        return ((CasError.ParseError) getError()).offset();
    }
}
