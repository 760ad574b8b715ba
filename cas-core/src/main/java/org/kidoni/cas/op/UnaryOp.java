package org.kidoni.cas.op;

import java.util.Arrays;
import java.util.Optional;

import org.kidoni.cas.error.CasError;
import org.kidoni.cas.error.ExpressionException;

/**
 * Prefix signs and the single-argument math functions. A function operator carries the name it is
 * called by, so a call node and a unary node for the same function share one implementation.
 */
public enum UnaryOp {
    PLUS("+", false),
    NEGATE("-", false),
    SIN("sin", true),
    COS("cos", true),
    TAN("tan", true),
    LOG10("log", true),
    LN("ln", true),
    SQRT("sqrt", true),
    ABS("abs", true);

    private final String symbol;
    private final boolean function;

    UnaryOp(final String symbol, final boolean function) {
        this.symbol = symbol;
        this.function = function;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isFunction() {
        return function;
    }

    public static Optional<UnaryOp> forFunctionName(final String name) {
        return Arrays.stream(values())
                .filter(op -> op.function && op.symbol.equals(name))
                .findFirst();
    }

    public double apply(final double value) {
        return switch (this) {
            case PLUS -> value;
            case NEGATE -> -value;
            case SIN -> Math.sin(value);
            case COS -> Math.cos(value);
            case TAN -> Math.tan(value);
            case LOG10 -> {
                checkDomain(value > 0.0, value);
                yield Math.log10(value);
            }
            case LN -> {
                checkDomain(value > 0.0, value);
                yield Math.log(value);
            }
            case SQRT -> {
                checkDomain(value >= 0.0, value);
                yield Math.sqrt(value);
            }
            case ABS -> Math.abs(value);
        };
    }

    public String render(final String operand) {
        return function ? symbol + "(" + operand + ")" : symbol + operand;
    }

    private void checkDomain(final boolean valid, final double value) {
        if (!valid) {
            throw new ExpressionException(new CasError.DomainError(symbol, value));
        }
    }
}
