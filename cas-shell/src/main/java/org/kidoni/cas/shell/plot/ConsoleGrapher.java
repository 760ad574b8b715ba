package org.kidoni.cas.shell.plot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.kidoni.cas.shell.plot.FunctionSampler.Point;
import org.kidoni.cas.shell.plot.FunctionSampler.Range;
import org.kidoni.cas.symbolic.Expr;

/**
 * Draws functions of one variable into a character grid.
 * <p>
 * Layers are drawn in order: grid lines every tenth of the window, then the axes where the window
 * contains zero, then one column sample per function, then a label line per function in the top
 * left corner.
 */
public class ConsoleGrapher {
    private static final char X_AXIS = '-';
    private static final char Y_AXIS = '|';
    private static final int MAX_LABELS = 5;

    private record Plot(String label, Expr function, char symbol) {
    }

    private final String variable;
    private final Map<String, Double> bindings;
    private final List<Plot> plots = new ArrayList<>();
    private PlotSettings settings;

    public ConsoleGrapher(final PlotSettings settings, final String variable) {
        this(settings, variable, Map.of());
    }

    public ConsoleGrapher(final PlotSettings settings, final String variable, final Map<String, Double> bindings) {
        this.settings = settings;
        this.variable = variable;
        this.bindings = Map.copyOf(bindings);
    }

    public PlotSettings settings() {
        return settings;
    }

    public void addFunction(final String label, final Expr function, final char symbol) {
        plots.add(new Plot(label, function, symbol));
    }

    public void clearFunctions() {
        plots.clear();
    }

    /**
     * Fits the y-range to the sampled values of every function, padded by {@code padding} of the
     * span on each side and never by less than 1. Leaves the range alone when nothing could be
     * sampled.
     */
    public void autoFitY(final int samples, final double padding) {
        List<Expr> functions = plots.stream().map(Plot::function).toList();
        new FunctionSampler(variable, bindings)
                .range(functions, settings.xMin(), settings.xMax(), samples)
                .ifPresent(range -> fitTo(range, padding));
    }

    private void fitTo(final Range range, final double padding) {
        double pad = Math.max(range.span() * padding, 1.0);
        settings = settings.withYRange(range.min() - pad, range.max() + pad);
    }

    public List<String> render() {
        char[][] screen = new char[settings.height()][settings.width()];
        for (char[] row : screen) {
            Arrays.fill(row, ' ');
        }
        if (settings.showGrid()) {
            drawGrid(screen);
        }
        if (settings.showAxes()) {
            drawAxes(screen);
        }
        FunctionSampler sampler = new FunctionSampler(variable, bindings);
        for (Plot plot : plots) {
            for (Point point : sampler.sample(plot.function(), settings.xMin(), settings.xMax(), settings.width())) {
                put(screen, settings.worldXToScreen(point.x()), settings.worldYToScreen(point.y()), plot.symbol());
            }
        }
        drawLabels(screen);

        List<String> lines = new ArrayList<>(settings.height());
        for (char[] row : screen) {
            lines.add(new String(row).stripTrailing());
        }
        return lines;
    }

    private void drawGrid(final char[][] screen) {
        int columnStep = Math.max(1, settings.width() / 10);
        int rowStep = Math.max(1, settings.height() / 10);
        for (int row = 0; row < settings.height(); row += rowStep) {
            for (int column = 0; column < settings.width(); column += columnStep) {
                screen[row][column] = settings.gridChar();
            }
        }
    }

    private void drawAxes(final char[][] screen) {
        boolean hasXAxis = settings.yMin() <= 0 && settings.yMax() >= 0;
        boolean hasYAxis = settings.xMin() <= 0 && settings.xMax() >= 0;
        int axisRow = Math.min(settings.worldYToScreen(0), settings.height() - 1);
        int axisColumn = Math.min(settings.worldXToScreen(0), settings.width() - 1);
        if (hasXAxis) {
            Arrays.fill(screen[axisRow], X_AXIS);
        }
        if (hasYAxis) {
            for (char[] row : screen) {
                row[axisColumn] = Y_AXIS;
            }
        }
        if (hasXAxis && hasYAxis) {
            screen[axisRow][axisColumn] = settings.axesChar();
        }
    }

    private void drawLabels(final char[][] screen) {
        int rows = Math.min(Math.min(plots.size(), MAX_LABELS), settings.height());
        for (int i = 0; i < rows; i++) {
            Plot plot = plots.get(i);
            String text = plot.symbol() + ": " + plot.label();
            for (int column = 0; column < text.length() && column < settings.width(); column++) {
                screen[i][column] = text.charAt(column);
            }
        }
    }

    private void put(final char[][] screen, final int column, final int row, final char symbol) {
        if (settings.isOnScreen(column, row)) {
            screen[row][column] = symbol;
        }
    }
}
