package org.kidoni.cas.engine;

import org.kidoni.cas.error.CasError;
import org.kidoni.cas.error.ExpressionException;
import org.kidoni.cas.op.BinaryOp;
import org.kidoni.cas.symbolic.Expr;

import static org.kidoni.cas.symbolic.Expr.constant;
import static org.kidoni.cas.symbolic.Expr.div;
import static org.kidoni.cas.symbolic.Expr.mul;
import static org.kidoni.cas.symbolic.Expr.negate;

/**
 * Solves {@code expression = 0} when the expression is a constant added to or subtracted from a
 * term linear in the unknown, e.g. {@code 2x - 3} or {@code 5 + x/4}. No other equation is solved.
 */
final class LinearSolver {
    private LinearSolver() {
    }

    static Expr solve(final Expr root, final String variable) {
        if (!(root instanceof Expr.BinaryExpr b) || (b.op() != BinaryOp.ADD && b.op() != BinaryOp.SUB)) {
            throw unsupported(root, variable);
        }

        Expr constantSide;
        Expr slope;
        if (b.left().isConstant()) {
            constantSide = b.left();
            slope = slope(b.right(), variable);
        }
        else if (b.right().isConstant()) {
            constantSide = b.right();
            slope = slope(b.left(), variable);
        }
        else {
            throw unsupported(root, variable);
        }
        if (slope == null) {
            throw unsupported(root, variable);
        }

        // c + a x = 0 and a x + c = 0 give -c/a; c - a x = 0 and a x - c = 0 give c/a
        Expr numerator = b.op() == BinaryOp.ADD ? negate(constantSide.copy()) : constantSide.copy();
        return div(numerator, slope).simplify();
    }

    /**
     * The factor {@code a} of a term of the form {@code a x}, or {@code null} when the term has any
     * other shape.
     */
    private static Expr slope(final Expr term, final String variable) {
        if (term instanceof Expr.VarExpr v) {
            return v.is(variable) ? constant(1.0) : null;
        }
        if (term instanceof Expr.UnaryExpr u) {
            Expr inner = slope(u.operand(), variable);
            if (inner == null) {
                return null;
            }
            return switch (u.op()) {
                case PLUS -> inner;
                case NEGATE -> negate(inner);
                default -> null;
            };
        }
        if (term instanceof Expr.BinaryExpr b) {
            if (b.op() == BinaryOp.MUL && b.left().isConstant()) {
                Expr inner = slope(b.right(), variable);
                return inner == null ? null : mul(b.left().copy(), inner);
            }
            if (b.op() == BinaryOp.MUL && b.right().isConstant()) {
                Expr inner = slope(b.left(), variable);
                return inner == null ? null : mul(inner, b.right().copy());
            }
            if (b.op() == BinaryOp.DIV && b.right().isConstant()) {
                Expr inner = slope(b.left(), variable);
                return inner == null ? null : div(inner, b.right().copy());
            }
        }
        return null;
    }

    private static ExpressionException unsupported(final Expr root, final String variable) {
        return new ExpressionException(new CasError.UnsupportedEquation(
                root.toDisplayString() + " = 0 is not linear in " + variable));
    }
}
