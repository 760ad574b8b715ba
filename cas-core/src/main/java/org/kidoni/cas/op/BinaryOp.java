package org.kidoni.cas.op;

import org.kidoni.cas.error.CasError;
import org.kidoni.cas.error.ExpressionException;

public enum BinaryOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    POW("^");

    private final String symbol;

    BinaryOp(final String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public double apply(final double left, final double right) {
        return switch (this) {
            case ADD -> left + right;
            case SUB -> left - right;
            case MUL -> left * right;
            case DIV -> {
                if (right == 0.0) {
                    throw new ExpressionException(new CasError.DivisionByZero());
                }
                yield left / right;
            }
            case POW -> Math.pow(left, right);
        };
    }
}
