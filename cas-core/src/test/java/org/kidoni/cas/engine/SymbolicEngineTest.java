package org.kidoni.cas.engine;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kidoni.cas.error.CasError;
import org.kidoni.cas.error.Result;
import org.kidoni.cas.symbolic.Expr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SymbolicEngineTest {
    private SymbolicEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SymbolicEngine();
    }

    private static String render(final Result<Expr> result) {
        return result.orElseThrow().simplify().toDisplayString();
    }

    @Test
    void emptyEngineReportsNoExpression() {
        assertFalse(engine.hasExpression());
        assertEquals(Result.err(new CasError.NoExpression()), engine.differentiate("x"));
        assertEquals(Result.err(new CasError.NoExpression()), engine.integrate("x"));
        assertEquals(Result.err(new CasError.NoExpression()), engine.simplify());
        assertEquals(Result.err(new CasError.NoExpression()), engine.evaluate(Map.of()));
        assertEquals(Result.err(new CasError.NoExpression()), engine.toDisplayString());
        assertEquals(Result.err(new CasError.NoExpression()), engine.solve("x"));
        assertEquals(Result.err(new CasError.NoExpression()), engine.factor());
    }

    @Test
    void parseFailureClearsTheCurrentExpression() {
        assertTrue(engine.parseFromString("x + 1").isOk());
        assertTrue(engine.hasExpression());

        var result = engine.parseFromString("2 +");

        assertFalse(result.isOk());
        assertFalse(engine.hasExpression());
        var error = engine.lastError().orElseThrow();
        assertInstanceOf(CasError.ParseError.class, error);
        assertTrue(((CasError.ParseError) error).offset() >= 0);
        assertEquals(Result.err(new CasError.NoExpression()), engine.evaluate(Map.of("x", 1.0)));
    }

    @Test
    void successfulLoadClearsLastError() {
        engine.parseFromString(")");
        assertTrue(engine.lastError().isPresent());

        engine.parseFromString("x");

        assertEquals(Optional.empty(), engine.lastError());
    }

    @Test
    void evaluate() {
        engine.parseFromString("2 + 3 * 4");
        assertEquals(Result.ok(14.0), engine.evaluate(Map.of()));

        engine.parseFromString("2^3^2");
        assertEquals(Result.ok(512.0), engine.evaluate(Map.of()));

        engine.parseFromString("2x");
        assertEquals(Result.ok(10.0), engine.evaluate(Map.of("x", 5.0)));
    }

    @Test
    void evaluationFailuresAreValues() {
        engine.parseFromString("1/0");
        assertEquals(Result.err(new CasError.DivisionByZero()), engine.evaluate(Map.of()));

        engine.parseFromString("sqrt(-1)");
        assertInstanceOf(CasError.DomainError.class, engine.evaluate(Map.of()).failure().orElseThrow());

        engine.parseFromString("x + y");
        assertEquals(Result.err(new CasError.UndefinedVariable("y")), engine.evaluate(Map.of("x", 1.0)));
    }

    @Test
    void calculus() {
        engine.parseFromString("x");
        assertEquals("1", render(engine.differentiate("x")));
        assertEquals("0", render(engine.differentiate("y")));

        engine.parseFromString("sin(x)");
        assertEquals("-cos(x)", render(engine.integrate("x")));

        engine.parseFromString("2^x");
        assertInstanceOf(CasError.UnsupportedDifferentiation.class, engine.differentiate("x").failure().orElseThrow());
        assertInstanceOf(CasError.UnsupportedIntegration.class, engine.integrate("x").failure().orElseThrow());
        assertTrue(engine.hasExpression());
    }

    @Test
    void simplifyAndDisplay() {
        engine.parseFromString("x + 0");
        assertEquals("x", engine.simplify().orElseThrow().toDisplayString());
        assertEquals(Result.ok("(x + 0)"), engine.toDisplayString());

        engine.parseFromString("x / 0");
        assertEquals(Result.err(new CasError.DivisionByZero()), engine.simplify());
    }

    @Test
    void solveLinearEquations() {
        engine.parseFromString("2*x - 3");
        assertEquals("1.5", render(engine.solve("x")));

        engine.parseFromString("x + 4");
        assertEquals("-4", render(engine.solve("x")));

        engine.parseFromString("3 - 2x");
        assertEquals("1.5", render(engine.solve("x")));

        engine.parseFromString("5 + x/4");
        assertEquals("-20", render(engine.solve("x")));

        engine.parseFromString("-x + 2 + 0");
        assertEquals("2", render(engine.solve("x")));
    }

    @Test
    void solutionSatisfiesTheEquation() {
        engine.parseFromString("0.5 * (3 * y) + 7");
        double root = engine.solve("y").orElseThrow().evaluate();

        assertEquals(0.0, engine.evaluate(Map.of("y", root)).orElseThrow(), 1e-12);
    }

    @Test
    void solveRejectsOtherShapes() {
        for (String input : List.of("x^2 - 4", "x * y - 1", "sin(x) + 1", "2x", "x + y", "y - 3")) {
            engine.parseFromString(input);
            assertInstanceOf(CasError.UnsupportedEquation.class, engine.solve("x").failure().orElseThrow(), input);
        }
    }

    @Test
    void factor() {
        engine.parseFromString("x^2 + x");
        var factors = engine.factor().orElseThrow();

        assertEquals(List.of("x", "(x + 1)"), factors.stream().map(Expr::toDisplayString).toList());

        engine.parseFromString("t + t^2");
        assertEquals(List.of("t", "(t + 1)"), engine.factor().orElseThrow().stream().map(Expr::toDisplayString).toList());

        engine.parseFromString("(x + 1) * sin(x)");
        assertEquals(List.of("(x + 1)", "sin(x)"), engine.factor().orElseThrow().stream().map(Expr::toDisplayString).toList());
    }

    @Test
    void factorFallsBackToTheSimplifiedExpression() {
        engine.parseFromString("x^2 - 1 + 0");

        var factors = engine.factor().orElseThrow();

        assertEquals(1, factors.size());
        assertEquals("((x ^ 2) - 1)", factors.get(0).toDisplayString());
    }

    @Test
    void factorsMultiplyBackToTheOriginal() {
        for (String input : List.of("x^2 + x", "3 * (x - 2)", "x^3 + 1")) {
            engine.parseFromString(input);
            var bindings = Map.of("x", 1.7);
            double product = engine.factor().orElseThrow().stream()
                    .mapToDouble(f -> f.evaluate(bindings))
                    .reduce(1.0, (a, b) -> a * b);

            assertEquals(engine.evaluate(bindings).orElseThrow(), product, 1e-9, input);
        }
    }

    @Test
    void loadProgrammaticTrees() {
        engine.load(Expr.mul(Expr.constant(2), Expr.variable("x")));
        assertEquals(Result.ok("2x"), engine.toDisplayString());

        engine.load(null);
        assertFalse(engine.hasExpression());

        engine.clear();
        assertEquals(Optional.empty(), engine.lastError());
    }

    @Test
    void staticParseLeavesEngineStateAlone() {
        assertTrue(SymbolicEngine.parse("x^2").isOk());
        assertEquals(new CasError.ParseError("unexpected end of input", 3),
                SymbolicEngine.parse("2 +").failure().orElseThrow());
        assertFalse(engine.hasExpression());
    }
}
