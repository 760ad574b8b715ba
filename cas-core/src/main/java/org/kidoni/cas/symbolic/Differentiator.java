package org.kidoni.cas.symbolic;

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

/**
 * Single-variable differentiation by structural rewriting. Results are not simplified.
 */
final class Differentiator {
    private static final double LN_10 = Math.log(10.0);

    private Differentiator() {
    }

    static Expr differentiate(final Expr expr, final String variable) {
        if (expr instanceof Expr.ConstExpr) {
            return constant(0.0);
        }
        if (expr instanceof Expr.VarExpr v) {
            return constant(v.is(variable) ? 1.0 : 0.0);
        }
        if (expr instanceof Expr.BinaryExpr b) {
            return binary(b, variable);
        }
        if (expr instanceof Expr.UnaryExpr u) {
            return chain(u.op(), u.operand(), variable);
        }
        if (expr instanceof Expr.CallExpr c) {
            return call(c, variable);
        }
        throw new ExpressionException(new CasError.UnrecognizedNode(expr.getClass().getSimpleName()));
    }

    private static Expr binary(final Expr.BinaryExpr b, final String variable) {
        Expr u = b.left();
        Expr v = b.right();

        return switch (b.op()) {
            case ADD -> add(differentiate(u, variable), differentiate(v, variable));
            case SUB -> sub(differentiate(u, variable), differentiate(v, variable));
            // u v' + v u'
            case MUL -> add(mul(u.copy(), differentiate(v, variable)), mul(v.copy(), differentiate(u, variable)));
            // (v u' - u v') / v^2
            case DIV -> div(
                    sub(mul(v.copy(), differentiate(u, variable)), mul(u.copy(), differentiate(v, variable))),
                    pow(v.copy(), constant(2.0)));
            case POW -> power(u, v, variable);
        };
    }

    private static Expr power(final Expr base, final Expr exponent, final String variable) {
        if (!exponent.isConstant()) {
            throw new ExpressionException(new CasError.UnsupportedDifferentiation(
                    "exponent " + exponent.toDisplayString() + " is not constant"));
        }

        double n = exponent.evaluate();
        return mul(mul(constant(n), pow(base.copy(), constant(n - 1.0))), differentiate(base, variable));
    }

    private static Expr chain(final UnaryOp op, final Expr operand, final String variable) {
        Expr inner = differentiate(operand, variable);

        if (op == UnaryOp.PLUS) {
            return inner;
        }
        if (op == UnaryOp.NEGATE) {
            return negate(inner);
        }
        return mul(outerDerivative(op, operand), inner);
    }

    private static Expr outerDerivative(final UnaryOp op, final Expr u) {
        return switch (op) {
            case SIN -> unary(UnaryOp.COS, u.copy());
            case COS -> negate(unary(UnaryOp.SIN, u.copy()));
            // sec^2(u)
            case TAN -> div(constant(1.0), pow(unary(UnaryOp.COS, u.copy()), constant(2.0)));
            case LN -> div(constant(1.0), u.copy());
            case LOG10 -> div(constant(1.0), mul(u.copy(), constant(LN_10)));
            case SQRT -> div(constant(1.0), mul(constant(2.0), unary(UnaryOp.SQRT, u.copy())));
            case ABS -> div(u.copy(), unary(UnaryOp.ABS, u.copy()));
            case PLUS, NEGATE -> throw new IllegalArgumentException(op + " is not a function");
        };
    }

    private static Expr call(final Expr.CallExpr c, final String variable) {
        Expr argument = c.soleArgument();
        if (argument == null) {
            throw new ExpressionException(new CasError.UnsupportedDifferentiation(
                    c.name() + " with " + c.arguments().size() + " arguments"));
        }

        return switch (c.name()) {
            case "sin" -> chain(UnaryOp.SIN, argument, variable);
            case "cos" -> chain(UnaryOp.COS, argument, variable);
            case "ln" -> chain(UnaryOp.LN, argument, variable);
            default -> throw new ExpressionException(new CasError.UnsupportedDifferentiation(
                    "no derivative rule for function " + c.name()));
        };
    }
}
