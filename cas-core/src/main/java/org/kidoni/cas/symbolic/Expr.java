package org.kidoni.cas.symbolic;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.kidoni.cas.error.CasError;
import org.kidoni.cas.error.ExpressionException;
import org.kidoni.cas.op.BinaryOp;
import org.kidoni.cas.op.Functions;
import org.kidoni.cas.op.Numerals;
import org.kidoni.cas.op.UnaryOp;

/**
 * Expression tree carrying the algebraic operations. Trees are immutable: every operation returns
 * a new tree and leaves the receiver untouched.
 */
public sealed interface Expr {
    double evaluate(Map<String, Double> bindings);

    /**
     * True when every leaf is a number.
     */
    boolean isConstant();

    /**
     * Deep copy; the result shares no node with this tree.
     */
    Expr copy();

    String toDisplayString();

    /**
     * Structural test for the number zero. May answer {@code false} for a subtree that happens to
     * evaluate to zero, never {@code true} for one that does not.
     */
    default boolean isZero() {
        return false;
    }

    /**
     * Structural test for the number one, with the same guarantee as {@link #isZero()}.
     */
    default boolean isOne() {
        return false;
    }

    default double evaluate() {
        return evaluate(Map.of());
    }

    default Expr differentiate(final String variable) {
        return Differentiator.differentiate(this, variable);
    }

    default Expr integrate(final String variable) {
        return Integrator.integrate(this, variable);
    }

    default Expr simplify() {
        return Simplifier.simplify(this);
    }

    static Expr constant(final double value) {
        return new ConstExpr(value);
    }

    static Expr variable(final String name) {
        return new VarExpr(name);
    }

    static Expr add(final Expr left, final Expr right) {
        return new BinaryExpr(BinaryOp.ADD, left, right);
    }

    static Expr sub(final Expr left, final Expr right) {
        return new BinaryExpr(BinaryOp.SUB, left, right);
    }

    static Expr mul(final Expr left, final Expr right) {
        return new BinaryExpr(BinaryOp.MUL, left, right);
    }

    static Expr div(final Expr left, final Expr right) {
        return new BinaryExpr(BinaryOp.DIV, left, right);
    }

    static Expr pow(final Expr base, final Expr exponent) {
        return new BinaryExpr(BinaryOp.POW, base, exponent);
    }

    static Expr negate(final Expr operand) {
        return new UnaryExpr(UnaryOp.NEGATE, operand);
    }

    static Expr unary(final UnaryOp op, final Expr operand) {
        return new UnaryExpr(op, operand);
    }

    static Expr call(final String name, final Expr... arguments) {
        return new CallExpr(name, Arrays.asList(arguments));
    }

    record ConstExpr(double value) implements Expr {
        @Override
        public double evaluate(final Map<String, Double> bindings) {
            return value;
        }

        @Override
        public boolean isConstant() {
            return true;
        }

        @Override
        public boolean isZero() {
            return value == 0.0;
        }

        @Override
        public boolean isOne() {
            return value == 1.0;
        }

        @Override
        public Expr copy() {
            return new ConstExpr(value);
        }

        @Override
        public String toDisplayString() {
            return Numerals.format(value);
        }
    }

    record VarExpr(String name) implements Expr {
        @Override
        public double evaluate(final Map<String, Double> bindings) {
            Double value = bindings.get(name);
            if (value == null) {
                throw new ExpressionException(new CasError.UndefinedVariable(name));
            }
            return value;
        }

        @Override
        public boolean isConstant() {
            return false;
        }

        @Override
        public Expr copy() {
            return new VarExpr(name);
        }

        @Override
        public String toDisplayString() {
            return name;
        }

        public boolean is(final String variable) {
            return name.equals(variable);
        }
    }

    record BinaryExpr(BinaryOp op, Expr left, Expr right) implements Expr {
        @Override
        public double evaluate(final Map<String, Double> bindings) {
            return op.apply(left.evaluate(bindings), right.evaluate(bindings));
        }

        @Override
        public boolean isConstant() {
            return left.isConstant() && right.isConstant();
        }

        @Override
        public Expr copy() {
            return new BinaryExpr(op, left.copy(), right.copy());
        }

        @Override
        public String toDisplayString() {
            if (op == BinaryOp.MUL) {
                if (left instanceof ConstExpr l && right instanceof ConstExpr r) {
                    return Numerals.format(l.value() * r.value());
                }
                if (left instanceof ConstExpr coefficient && !right.isConstant()) {
                    return withCoefficient(coefficient.value(), right);
                }
                if (right instanceof ConstExpr coefficient && !left.isConstant()) {
                    return withCoefficient(coefficient.value(), left);
                }
            }
            return "(" + left.toDisplayString() + " " + op.symbol() + " " + right.toDisplayString() + ")";
        }

        private static String withCoefficient(final double coefficient, final Expr operand) {
            String rendered = operand.toDisplayString();
            if (coefficient == 1.0) {
                return rendered;
            }
            if (coefficient == -1.0) {
                return "-" + rendered;
            }

            boolean simple = operand instanceof VarExpr || operand instanceof UnaryExpr || operand instanceof CallExpr;
            return Numerals.format(coefficient) + (simple ? rendered : "(" + rendered + ")");
        }
    }

    record UnaryExpr(UnaryOp op, Expr operand) implements Expr {
        @Override
        public double evaluate(final Map<String, Double> bindings) {
            return op.apply(operand.evaluate(bindings));
        }

        @Override
        public boolean isConstant() {
            return operand.isConstant();
        }

        @Override
        public boolean isZero() {
            return (op == UnaryOp.PLUS || op == UnaryOp.NEGATE) && operand.isZero();
        }

        @Override
        public boolean isOne() {
            return op == UnaryOp.PLUS && operand.isOne();
        }

        @Override
        public Expr copy() {
            return new UnaryExpr(op, operand.copy());
        }

        @Override
        public String toDisplayString() {
            return op.render(operand.toDisplayString());
        }
    }

    record CallExpr(String name, List<Expr> arguments) implements Expr {
        public CallExpr {
            arguments = List.copyOf(arguments);
        }

        @Override
        public double evaluate(final Map<String, Double> bindings) {
            List<Double> values = arguments.stream()
                    .map(argument -> argument.evaluate(bindings))
                    .toList();
            return Functions.call(name, values);
        }

        @Override
        public boolean isConstant() {
            return arguments.stream().allMatch(Expr::isConstant);
        }

        @Override
        public Expr copy() {
            return new CallExpr(name, arguments.stream().map(Expr::copy).toList());
        }

        @Override
        public String toDisplayString() {
            return arguments.stream()
                    .map(Expr::toDisplayString)
                    .collect(Collectors.joining(", ", name + "(", ")"));
        }

        /**
         * The single argument of a one-argument call, or {@code null}.
         */
        public Expr soleArgument() {
            return arguments.size() == 1 ? arguments.get(0) : null;
        }
    }
}
