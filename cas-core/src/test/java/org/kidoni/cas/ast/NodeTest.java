package org.kidoni.cas.ast;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.kidoni.cas.error.CasError;
import org.kidoni.cas.error.ExpressionException;
import org.kidoni.cas.op.BinaryOp;
import org.kidoni.cas.op.UnaryOp;
import org.kidoni.cas.parser.Parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NodeTest {
    private static Node parse(final String input) {
        return new Parser(input).parse();
    }

    @Test
    void evaluateWithBindings() {
        assertEquals(10.0, parse("2x").evaluate(Map.of("x", 5.0)));
        assertEquals(10.0, parse("2*x").evaluate(Map.of("x", 5.0)));
        assertEquals(7.0, parse("x + y").evaluate(Map.of("x", 3.0, "y", 4.0)));
    }

    @Test
    void unboundVariableFails() {
        var e = assertThrows(ExpressionException.class, () -> parse("x + 1").evaluate());

        assertEquals(new CasError.UndefinedVariable("x"), e.getError());
    }

    @Test
    void divisionByZeroFails() {
        var e = assertThrows(ExpressionException.class, () -> parse("1/0").evaluate());

        assertInstanceOf(CasError.DivisionByZero.class, e.getError());
    }

    @Test
    void domainErrors() {
        assertEquals(new CasError.DomainError("sqrt", -1.0),
                assertThrows(ExpressionException.class, () -> parse("sqrt(-1)").evaluate()).getError());
        assertEquals(new CasError.DomainError("log", 0.0),
                assertThrows(ExpressionException.class, () -> parse("log(0)").evaluate()).getError());
        assertEquals(new CasError.DomainError("ln", -2.0),
                assertThrows(ExpressionException.class, () -> parse("ln(-2)").evaluate()).getError());
    }

    @Test
    void callAndUnaryEncodingsAgree() {
        for (UnaryOp op : UnaryOp.values()) {
            if (!op.isFunction()) {
                continue;
            }
            var unary = new Node.UnaryNode(op, new Node.ConstNode(0.7));
            var call = new Node.CallNode(op.symbol(), List.of(new Node.ConstNode(0.7)));

            assertEquals(unary.evaluate(), call.evaluate(), op.name());
            assertEquals(unary.toDisplayString(), call.toDisplayString());
        }
    }

    @Test
    void callArityIsChecked() {
        var e = assertThrows(ExpressionException.class, () -> parse("sin(1, 2)").evaluate());

        assertEquals(new CasError.ArityMismatch("sin", 1, 2), e.getError());
    }

    @Test
    void unknownFunctionFails() {
        var call = new Node.CallNode("cosh", List.of(new Node.ConstNode(1.0)));

        assertEquals(new CasError.UnknownFunction("cosh"),
                assertThrows(ExpressionException.class, call::evaluate).getError());
    }

    @Test
    void copyIsDeepAndEqual() {
        var original = parse("sin(x) + 2 * -y");
        var copy = original.copy();

        assertEquals(original, copy);
        assertNotSame(original, copy);
        assertNotSame(((Node.BinaryNode) original).left(), ((Node.BinaryNode) copy).left());
    }

    @Test
    void displayUsesUniformParentheses() {
        var tree = new Node.BinaryNode(BinaryOp.MUL, new Node.ConstNode(2.0), new Node.VarNode("x"));

        assertEquals("(2 * x)", tree.toDisplayString());
        assertEquals("-(2 * x)", new Node.UnaryNode(UnaryOp.NEGATE, tree).toDisplayString());
        assertEquals("0.5", new Node.ConstNode(0.5).toDisplayString());
    }
}
