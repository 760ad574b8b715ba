package org.kidoni.cas.engine;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.kidoni.cas.ast.Node;
import org.kidoni.cas.error.CasError;
import org.kidoni.cas.error.Result;
import org.kidoni.cas.parser.Parser;
import org.kidoni.cas.symbolic.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds one current expression and exposes the algebra on it. Every operation reports failure as a
 * {@link Result.Err} rather than throwing.
 * <p>
 * Not thread-safe: loading a new expression must not race any other call on the same instance.
 */
public class SymbolicEngine {
    private static final Logger LOG = LoggerFactory.getLogger(SymbolicEngine.class);

    private Expr expression;
    private CasError lastError;

    /**
     * Parses {@code text} without touching any engine state.
     */
    public static Result<Expr> parse(final String text) {
        return Result.of(() -> AstConverter.convert(new Parser(text).parse()));
    }

    public Result<Expr> parseFromString(final String text) {
        LOG.trace("parsing '{}'", text);
        return install(parse(text));
    }

    public Result<Expr> loadFromAst(final Node ast) {
        return install(Result.of(() -> AstConverter.convert(ast)));
    }

    public Result<Expr> load(final Expr expr) {
        return install(expr == null ? Result.err(new CasError.NoExpression()) : Result.ok(expr));
    }

    public boolean hasExpression() {
        return expression != null;
    }

    public Optional<Expr> expression() {
        return Optional.ofNullable(expression);
    }

    /**
     * Why the last load failed; empty once an expression has been loaded successfully.
     */
    public Optional<CasError> lastError() {
        return Optional.ofNullable(lastError);
    }

    public void clear() {
        expression = null;
        lastError = null;
    }

    public Result<Expr> differentiate(final String variable) {
        return withExpression(e -> e.differentiate(variable));
    }

    public Result<Expr> integrate(final String variable) {
        return withExpression(e -> e.integrate(variable));
    }

    public Result<Expr> simplify() {
        return withExpression(Expr::simplify);
    }

    public Result<Double> evaluate(final Map<String, Double> bindings) {
        return withExpression(e -> e.evaluate(bindings));
    }

    public Result<String> toDisplayString() {
        return withExpression(Expr::toDisplayString);
    }

    /**
     * Solves {@code expression = 0} for {@code variable}; only linear equations are supported.
     */
    public Result<Expr> solve(final String variable) {
        return withExpression(e -> LinearSolver.solve(e.simplify(), variable));
    }

    /**
     * Factors whose product evaluates like the current expression. When no factoring rule applies
     * the simplified expression is the only factor.
     */
    public Result<List<Expr>> factor() {
        return withExpression(e -> Factorizer.factor(e.simplify()));
    }

    private Result<Expr> install(final Result<Expr> loaded) {
        if (loaded instanceof Result.Ok<Expr> ok) {
            expression = ok.value();
            lastError = null;
        }
        else {
            expression = null;
            lastError = loaded.failure().orElseThrow();
            LOG.debug("no expression loaded: {}", lastError.message());
        }
        return loaded;
    }

    private <T> Result<T> withExpression(final Function<Expr, T> operation) {
        if (expression == null) {
            return Result.err(new CasError.NoExpression());
        }
        Result<T> result = Result.of(() -> operation.apply(expression));
        result.failure().ifPresent(error -> LOG.debug("operation failed on {}: {}", expression.toDisplayString(), error.message()));
        return result;
    }
}
