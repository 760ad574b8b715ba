package org.kidoni.cas.ast;

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
 * Syntax tree produced by the parser.
 */
public sealed interface Node {
    String toDisplayString();

    double evaluate(Map<String, Double> bindings);

    /**
     * Deep copy; the result shares no node with this tree.
     */
    Node copy();

    default double evaluate() {
        return evaluate(Map.of());
    }

    record ConstNode(double value) implements Node {
        @Override
        public String toDisplayString() {
            return Numerals.format(value);
        }

        @Override
        public double evaluate(final Map<String, Double> bindings) {
            return value;
        }

        @Override
        public Node copy() {
            return new ConstNode(value);
        }
    }

    record VarNode(String name) implements Node {
        @Override
        public String toDisplayString() {
            return name;
        }

        @Override
        public double evaluate(final Map<String, Double> bindings) {
            Double value = bindings.get(name);
            if (value == null) {
                throw new ExpressionException(new CasError.UndefinedVariable(name));
            }
            return value;
        }

        @Override
        public Node copy() {
            return new VarNode(name);
        }
    }

    record BinaryNode(BinaryOp op, Node left, Node right) implements Node {
        @Override
        public String toDisplayString() {
            return "(" + left.toDisplayString() + " " + op.symbol() + " " + right.toDisplayString() + ")";
        }

        @Override
        public double evaluate(final Map<String, Double> bindings) {
            return op.apply(left.evaluate(bindings), right.evaluate(bindings));
        }

        @Override
        public Node copy() {
            return new BinaryNode(op, left.copy(), right.copy());
        }
    }

    record UnaryNode(UnaryOp op, Node operand) implements Node {
        @Override
        public String toDisplayString() {
            return op.render(operand.toDisplayString());
        }

        @Override
        public double evaluate(final Map<String, Double> bindings) {
            return op.apply(operand.evaluate(bindings));
        }

        @Override
        public Node copy() {
            return new UnaryNode(op, operand.copy());
        }
    }

    record CallNode(String name, List<Node> arguments) implements Node {
        public CallNode {
            arguments = List.copyOf(arguments);
        }

        @Override
        public String toDisplayString() {
            return arguments.stream()
                    .map(Node::toDisplayString)
                    .collect(Collectors.joining(", ", name + "(", ")"));
        }

        @Override
        public double evaluate(final Map<String, Double> bindings) {
            List<Double> values = arguments.stream()
                    .map(argument -> argument.evaluate(bindings))
                    .toList();
            return Functions.call(name, values);
        }

        @Override
        public Node copy() {
            return new CallNode(name, arguments.stream().map(Node::copy).toList());
        }
    }
}
