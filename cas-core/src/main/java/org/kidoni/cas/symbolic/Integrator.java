package org.kidoni.cas.symbolic;

import java.util.Optional;

import org.kidoni.cas.error.CasError;
import org.kidoni.cas.error.ExpressionException;
import org.kidoni.cas.op.UnaryOp;

import static org.kidoni.cas.symbolic.Expr.add;
import static org.kidoni.cas.symbolic.Expr.constant;
import static org.kidoni.cas.symbolic.Expr.div;
import static org.kidoni.cas.symbolic.Expr.mul;
import static org.kidoni.cas.symbolic.Expr.negate;
import static org.kidoni.cas.symbolic.Expr.pow;
import static org.kidoni.cas.symbolic.Expr.sub;
import static org.kidoni.cas.symbolic.Expr.unary;
import static org.kidoni.cas.symbolic.Expr.variable;

/**
 * Antiderivatives for a small table of forms. Anything outside the table fails with
 * {@link CasError.UnsupportedIntegration}; there is no integration by parts or substitution.
 * The constant of integration is left to the caller.
 */
final class Integrator {
    private Integrator() {
    }

    static Expr integrate(final Expr expr, final String variable) {
        if (expr instanceof Expr.ConstExpr c) {
            return mul(constant(c.value()), variable(variable));
        }
        if (expr instanceof Expr.VarExpr v) {
            if (v.is(variable)) {
                return div(pow(variable(variable), constant(2.0)), constant(2.0));
            }
            return mul(variable(v.name()), variable(variable));
        }
        if (expr instanceof Expr.BinaryExpr b) {
            return binary(b, variable);
        }
        if (expr instanceof Expr.UnaryExpr u) {
            return unaryOp(u.op(), u.operand(), variable);
        }
        if (expr instanceof Expr.CallExpr c) {
            return call(c, variable);
        }
        throw new ExpressionException(new CasError.UnrecognizedNode(expr.getClass().getSimpleName()));
    }

    private static Expr binary(final Expr.BinaryExpr b, final String variable) {
        Expr left = b.left();
        Expr right = b.right();

        return switch (b.op()) {
            case ADD -> add(integrate(left, variable), integrate(right, variable));
            case SUB -> sub(integrate(left, variable), integrate(right, variable));
            case MUL -> {
                if (left.isConstant() && !right.isConstant()) {
                    yield mul(left.copy(), integrate(right, variable));
                }
                if (!left.isConstant() && right.isConstant()) {
                    yield mul(integrate(left, variable), right.copy());
                }
                throw unsupported("general product " + b.toDisplayString());
            }
            case DIV -> {
                if (left.isConstant() && isVariable(right, variable)) {
                    yield mul(left.copy(), unary(UnaryOp.LN, variable(variable)));
                }
                throw unsupported("quotient " + b.toDisplayString());
            }
            case POW -> {
                if (isVariable(left, variable) && right.isConstant()) {
                    double n = right.evaluate();
                    if (n == -1.0) {
                        yield unary(UnaryOp.LN, variable(variable));
                    }
                    yield div(pow(variable(variable), constant(n + 1.0)), constant(n + 1.0));
                }
                throw unsupported("power " + b.toDisplayString());
            }
        };
    }

    private static Expr unaryOp(final UnaryOp op, final Expr operand, final String variable) {
        if (op == UnaryOp.PLUS) {
            return integrate(operand, variable);
        }
        if (op == UnaryOp.NEGATE) {
            return negate(integrate(operand, variable));
        }
        if (!isVariable(operand, variable)) {
            throw unsupported(op.render(operand.toDisplayString()));
        }
        return elementary(op, variable)
                .orElseThrow(() -> unsupported(op.render(operand.toDisplayString())));
    }

    private static Expr call(final Expr.CallExpr c, final String variable) {
        Expr argument = c.soleArgument();
        if (argument == null || !isVariable(argument, variable)) {
            throw unsupported(c.toDisplayString());
        }

        return UnaryOp.forFunctionName(c.name())
                .flatMap(op -> elementary(op, variable))
                .orElseThrow(() -> unsupported(c.toDisplayString()));
    }

    private static Optional<Expr> elementary(final UnaryOp op, final String variable) {
        Expr x = variable(variable);
        return switch (op) {
            case SIN -> Optional.of(negate(unary(UnaryOp.COS, x)));
            case COS -> Optional.of(unary(UnaryOp.SIN, x));
            // x ln(x) - x
            case LN -> Optional.of(sub(mul(x, unary(UnaryOp.LN, variable(variable))), variable(variable)));
            default -> Optional.empty();
        };
    }

    private static boolean isVariable(final Expr expr, final String variable) {
        return expr instanceof Expr.VarExpr v && v.is(variable);
    }

    private static ExpressionException unsupported(final String what) {
        return new ExpressionException(new CasError.UnsupportedIntegration(what));
    }
}
