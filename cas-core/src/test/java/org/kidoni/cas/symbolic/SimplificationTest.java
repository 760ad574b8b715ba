package org.kidoni.cas.symbolic;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.kidoni.cas.error.CasError;
import org.kidoni.cas.error.ExpressionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.kidoni.cas.symbolic.ExprTest.parse;

class SimplificationTest {
    private static String simplified(final String input) {
        return parse(input).simplify().toDisplayString();
    }

    @Test
    void additiveIdentities() {
        assertEquals(simplified("x"), simplified("x + 0"));
        assertEquals("x", simplified("0 + x"));
        assertEquals("x", simplified("x - 0"));
        assertEquals("-x", simplified("0 - x"));
    }

    @Test
    void multiplicativeIdentities() {
        assertEquals("0", simplified("0 * (x + y)"));
        assertEquals("0", simplified("x * 0"));
        assertEquals("x", simplified("1 * x"));
        assertEquals("x", simplified("x * 1"));
        assertEquals("x", simplified("x / 1"));
        assertEquals("0", simplified("0 / x"));
    }

    @Test
    void powerIdentities() {
        assertEquals("1", simplified("x ^ 0"));
        assertEquals("x", simplified("x ^ 1"));
        assertEquals("0", simplified("0 ^ x"));
        assertEquals("1", simplified("1 ^ x"));
    }

    @Test
    void literalDivisionByZeroFails() {
        var e = assertThrows(ExpressionException.class, () -> parse("x / 0").simplify());

        assertEquals(new CasError.DivisionByZero(), e.getError());
        assertThrows(ExpressionException.class, () -> parse("x / (2 - 2)").simplify());
    }

    @Test
    void constantFolding() {
        assertEquals("14", simplified("2 + 3 * 4"));
        assertEquals("512", simplified("2^3^2"));
        assertEquals("0", simplified("sin(0)"));
        assertEquals("x", simplified("cos(0) * x"));
        assertEquals("(x + 2.5)", simplified("x + 5/2"));
        assertEquals("-3", simplified("-(1 + 2)"));
    }

    @Test
    void constantsOutsideTheDomainStaySymbolic() {
        assertEquals("sqrt(-1)", simplified("sqrt(-1)"));
        assertEquals("(x + ln(0))", simplified("x + ln(0)"));
    }

    @Test
    void doubleNegationCollapses() {
        assertEquals("x", simplified("--x"));
        assertEquals("x", simplified("0 - -x"));
        assertEquals("sin(x)", simplified("-(-(sin(x)))"));
    }

    @Test
    void coefficientsMerge() {
        assertEquals("6x", simplified("2 * (3 * x)"));
        assertEquals("6x", simplified("(x * 3) * 2"));
        assertEquals("2x", simplified("(4x) / 2"));
        assertEquals("x", simplified("(2x) / 2"));
    }

    @Test
    void nothingToDo() {
        assertEquals("((x ^ 2) + (x * y))", simplified("x^2 + x*y"));
        assertEquals("sin(x)", simplified("+sin(x)"));
    }

    @Test
    void simplifyIsIdempotent() {
        for (String input : List.of("x + 0", "0 - x", "0 - -x", "2 * (3 * x) + 0", "(4x) / 8", "x^2 + x",
                "sqrt(-1) * x", "-(x - 1)", "sin(x)^1 * cos(0)", "x^3 / 3", "2^x - 0^y", "(x + 1)(x - 1)")) {
            var once = parse(input).simplify();
            assertEquals(once.toDisplayString(), once.simplify().toDisplayString(), input);
            assertEquals(once, once.simplify(), input);
        }
    }

    @Test
    void simplifyDoesNotModifyTheReceiver() {
        var expr = parse("0 + x * 1");
        var before = expr.copy();

        expr.simplify();

        assertEquals(before, expr);
    }
}
