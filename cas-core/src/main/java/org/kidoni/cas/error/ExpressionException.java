package org.kidoni.cas.error;

import java.util.Objects;

/**
 * Unchecked failure raised while parsing or operating on an expression tree.
 */
public class ExpressionException extends RuntimeException {
    private final CasError error;

    public ExpressionException(final CasError error) {
        super(Objects.requireNonNull(error).message());
        this.error = error;
    }

    public ExpressionException(final CasError error, final Throwable cause) {
        super(Objects.requireNonNull(error).message(), cause);
        this.error = error;
    }

    public CasError getError() {
        return error;
    }
}
