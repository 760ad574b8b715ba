package org.kidoni.cas.shell.plot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Defaults for the text-mode plotter.
 *
 * @param samples number of points used to fit the y-range when none is given
 * @param padding fraction of the sampled y-span added above and below when fitting
 */
@ConfigurationProperties("cas.plot")
public record PlotProperties(
        @DefaultValue("-10") double xMin,
        @DefaultValue("10") double xMax,
        @DefaultValue("-10") double yMin,
        @DefaultValue("10") double yMax,
        @DefaultValue("80") int width,
        @DefaultValue("24") int height,
        @DefaultValue("true") boolean showGrid,
        @DefaultValue("true") boolean showAxes,
        @DefaultValue(".") char gridChar,
        @DefaultValue("+") char axesChar,
        @DefaultValue("*") char functionChar,
        @DefaultValue("100") int samples,
        @DefaultValue("0.15") double padding) {

    public PlotSettings toSettings() {
        return new PlotSettings(xMin, xMax, yMin, yMax, width, height, showGrid, showAxes, gridChar, axesChar);
    }
}
