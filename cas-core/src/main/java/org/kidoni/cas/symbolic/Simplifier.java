package org.kidoni.cas.symbolic;

import org.kidoni.cas.error.CasError;
import org.kidoni.cas.error.ExpressionException;
import org.kidoni.cas.op.BinaryOp;
import org.kidoni.cas.op.UnaryOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.kidoni.cas.symbolic.Expr.constant;

/**
 * Bottom-up algebraic simplification: children first, then the identities for the operator at
 * hand. The result is always a fresh tree and simplifying it again changes nothing.
 */
final class Simplifier {
    private static final Logger LOG = LoggerFactory.getLogger(Simplifier.class);

    private Simplifier() {
    }

    static Expr simplify(final Expr expr) {
        if (expr instanceof Expr.BinaryExpr b) {
            return binary(b.op(), simplify(b.left()), simplify(b.right()));
        }
        if (expr instanceof Expr.UnaryExpr u) {
            return unary(u.op(), simplify(u.operand()));
        }
        if (expr instanceof Expr.CallExpr c) {
            Expr.CallExpr call = new Expr.CallExpr(c.name(), c.arguments().stream().map(Simplifier::simplify).toList());
            return call.isConstant() ? fold(call) : call;
        }
        return expr.copy();
    }

    static Expr binary(final BinaryOp op, final Expr left, final Expr right) {
        return switch (op) {
            case ADD -> {
                if (left.isZero()) {
                    yield right;
                }
                if (right.isZero()) {
                    yield left;
                }
                yield foldOrKeep(op, left, right);
            }
            case SUB -> {
                if (right.isZero()) {
                    yield left;
                }
                if (left.isZero()) {
                    yield unary(UnaryOp.NEGATE, right);
                }
                yield foldOrKeep(op, left, right);
            }
            case MUL -> multiply(left, right);
            case DIV -> {
                if (right.isZero()) {
                    throw new ExpressionException(new CasError.DivisionByZero());
                }
                if (left.isZero()) {
                    yield constant(0.0);
                }
                if (right.isOne()) {
                    yield left;
                }
                // (k e) / c -> (k/c) e
                if (right instanceof Expr.ConstExpr divisor) {
                    Coefficient scaled = Coefficient.of(left);
                    if (scaled != null) {
                        yield multiply(constant(scaled.value() / divisor.value()), scaled.rest());
                    }
                }
                yield foldOrKeep(op, left, right);
            }
            case POW -> {
                if (right.isZero()) {
                    yield constant(1.0);
                }
                if (right.isOne()) {
                    yield left;
                }
                if (left.isZero()) {
                    yield constant(0.0);
                }
                if (left.isOne()) {
                    yield constant(1.0);
                }
                yield foldOrKeep(op, left, right);
            }
        };
    }

    static Expr unary(final UnaryOp op, final Expr operand) {
        if (op == UnaryOp.PLUS) {
            return operand;
        }
        if (op == UnaryOp.NEGATE) {
            if (operand.isZero()) {
                return constant(0.0);
            }
            if (operand instanceof Expr.UnaryExpr inner && inner.op() == UnaryOp.NEGATE) {
                return inner.operand();
            }
        }

        Expr.UnaryExpr result = new Expr.UnaryExpr(op, operand);
        return operand.isConstant() ? fold(result) : result;
    }

    private static Expr multiply(final Expr left, final Expr right) {
        if (left.isZero() || right.isZero()) {
            return constant(0.0);
        }
        if (left.isOne()) {
            return right;
        }
        if (right.isOne()) {
            return left;
        }

        // c (k e) -> (c k) e
        Expr.ConstExpr factor = left instanceof Expr.ConstExpr l ? l : right instanceof Expr.ConstExpr r ? r : null;
        if (factor != null) {
            Coefficient nested = Coefficient.of(factor == left ? right : left);
            if (nested != null) {
                return multiply(constant(factor.value() * nested.value()), nested.rest());
            }
        }

        return foldOrKeep(BinaryOp.MUL, left, right);
    }

    private static Expr foldOrKeep(final BinaryOp op, final Expr left, final Expr right) {
        Expr.BinaryExpr result = new Expr.BinaryExpr(op, left, right);
        return left.isConstant() && right.isConstant() ? fold(result) : result;
    }

    // a constant subtree that cannot be evaluated to a finite number is kept as written
    private static Expr fold(final Expr constantExpr) {
        try {
            double value = constantExpr.evaluate();
            if (Double.isFinite(value)) {
                return constant(value);
            }
            LOG.debug("not folding {}: value {} is not finite", constantExpr.toDisplayString(), value);
        }
        catch (ExpressionException e) {
            LOG.debug("not folding {}: {}", constantExpr.toDisplayString(), e.getMessage());
        }
        return constantExpr;
    }

    /**
     * A product of a number and some other expression, in either order.
     */
    private record Coefficient(double value, Expr rest) {
        static Coefficient of(final Expr expr) {
            if (expr instanceof Expr.BinaryExpr b && b.op() == BinaryOp.MUL) {
                if (b.left() instanceof Expr.ConstExpr c) {
                    return new Coefficient(c.value(), b.right());
                }
                if (b.right() instanceof Expr.ConstExpr c) {
                    return new Coefficient(c.value(), b.left());
                }
            }
            return null;
        }
    }
}
