package org.kidoni.cas.shell.plot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.kidoni.cas.error.ExpressionException;
import org.kidoni.cas.symbolic.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates an expression at evenly spaced points of one variable. Points where evaluation fails or
 * yields a non-finite value are left out.
 */
public class FunctionSampler {
    private static final Logger LOG = LoggerFactory.getLogger(FunctionSampler.class);

    public record Point(double x, double y) {
    }

    public record Range(double min, double max) {
        public double span() {
            return max - min;
        }
    }

    private final String variable;
    private final Map<String, Double> bindings;

    public FunctionSampler(final String variable) {
        this(variable, Map.of());
    }

    /**
     * @param bindings values for every other variable the sampled expressions mention
     */
    public FunctionSampler(final String variable, final Map<String, Double> bindings) {
        this.variable = variable;
        this.bindings = Map.copyOf(bindings);
    }

    public List<Point> sample(final Expr function, final double from, final double to, final int count) {
        if (count < 2) {
            throw new IllegalArgumentException("at least two samples are needed but got " + count);
        }
        List<Point> points = new ArrayList<>(count);
        Map<String, Double> scope = new HashMap<>(bindings);
        double step = (to - from) / (count - 1);
        int skipped = 0;
        for (int i = 0; i < count; i++) {
            double x = from + i * step;
            scope.put(variable, x);
            try {
                double y = function.evaluate(scope);
                if (Double.isFinite(y)) {
                    points.add(new Point(x, y));
                }
                else {
                    skipped++;
                }
            }
            catch (ExpressionException e) {
                skipped++;
            }
        }
        if (skipped > 0) {
            LOG.debug("skipped {} of {} samples of {}", skipped, count, function.toDisplayString());
        }
        return points;
    }

    /**
     * Smallest and largest sampled value across all {@code functions}, empty when no point could be
     * evaluated.
     */
    public Optional<Range> range(final List<Expr> functions, final double from, final double to, final int count) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Expr function : functions) {
            for (Point point : sample(function, from, to, count)) {
                min = Math.min(min, point.y());
                max = Math.max(max, point.y());
            }
        }
        return min > max ? Optional.empty() : Optional.of(new Range(min, max));
    }
}
