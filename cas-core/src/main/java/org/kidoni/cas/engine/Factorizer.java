package org.kidoni.cas.engine;

import java.util.List;

import org.kidoni.cas.op.BinaryOp;
import org.kidoni.cas.symbolic.Expr;

import static org.kidoni.cas.symbolic.Expr.add;
import static org.kidoni.cas.symbolic.Expr.constant;
import static org.kidoni.cas.symbolic.Expr.variable;

/**
 * Rudimentary factoring. Only two shapes are recognised: a product, which splits into its operands,
 * and {@code v^2 + v}, which becomes {@code v (v + 1)}. Anything else comes back as a single factor,
 * which says nothing about whether the expression could be factored further.
 */
final class Factorizer {
    private Factorizer() {
    }

    static List<Expr> factor(final Expr simplified) {
        if (simplified instanceof Expr.BinaryExpr b) {
            if (b.op() == BinaryOp.MUL) {
                return List.of(b.left().copy(), b.right().copy());
            }
            if (b.op() == BinaryOp.ADD) {
                String v = squarePlusSelf(b.left(), b.right());
                if (v == null) {
                    v = squarePlusSelf(b.right(), b.left());
                }
                if (v != null) {
                    return List.of(variable(v), add(variable(v), constant(1.0)));
                }
            }
        }
        return List.of(simplified);
    }

    // name of v when square is v^2 and linear is v
    private static String squarePlusSelf(final Expr square, final Expr linear) {
        if (square instanceof Expr.BinaryExpr p
                && p.op() == BinaryOp.POW
                && p.left() instanceof Expr.VarExpr base
                && p.right() instanceof Expr.ConstExpr exponent
                && exponent.value() == 2.0
                && linear instanceof Expr.VarExpr v
                && v.is(base.name())) {
            return base.name();
        }
        return null;
    }
}
