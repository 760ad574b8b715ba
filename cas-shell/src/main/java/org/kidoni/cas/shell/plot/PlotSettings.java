package org.kidoni.cas.shell.plot;

/**
 * Visible window and character grid of one plot.
 */
public record PlotSettings(
        double xMin,
        double xMax,
        double yMin,
        double yMax,
        int width,
        int height,
        boolean showGrid,
        boolean showAxes,
        char gridChar,
        char axesChar) {

    public PlotSettings {
        if (!(xMax > xMin) || !(yMax > yMin)) {
            throw new IllegalArgumentException("empty plot range x=[" + xMin + ", " + xMax + "] y=[" + yMin + ", " + yMax + "]");
        }
        if (width < 2 || height < 2) {
            throw new IllegalArgumentException("plot size must be at least 2x2 but was " + width + "x" + height);
        }
    }

    public PlotSettings withXRange(final double min, final double max) {
        return new PlotSettings(min, max, yMin, yMax, width, height, showGrid, showAxes, gridChar, axesChar);
    }

    public PlotSettings withYRange(final double min, final double max) {
        return new PlotSettings(xMin, xMax, min, max, width, height, showGrid, showAxes, gridChar, axesChar);
    }

    public PlotSettings withSize(final int columns, final int rows) {
        return new PlotSettings(xMin, xMax, yMin, yMax, columns, rows, showGrid, showAxes, gridChar, axesChar);
    }

    public int worldXToScreen(final double x) {
        return (int) Math.floor((x - xMin) * width / (xMax - xMin));
    }

    public int worldYToScreen(final double y) {
        return (int) Math.floor((yMax - y) * height / (yMax - yMin));
    }

    public double screenXToWorld(final int column) {
        return xMin + column * (xMax - xMin) / width;
    }

    public double screenYToWorld(final int row) {
        return yMax - row * (yMax - yMin) / height;
    }

    public boolean isOnScreen(final int column, final int row) {
        return column >= 0 && column < width && row >= 0 && row < height;
    }
}
