package org.kidoni.cas.shell.plot;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Arguments of the {@code plot} command: an expression followed by optional {@code key:value}
 * window options.
 * <pre>
 * plot x^2 - 3 xmin:-5 xmax:5 ymin:-2 ymax:20 width:60 height:20
 * </pre>
 * The y-range counts as given only when both {@code ymin} and {@code ymax} are present.
 */
public record PlotRequest(String expression, PlotSettings settings, boolean fixedYRange) {

    public static PlotRequest parse(final String arguments, final PlotSettings defaults) {
        List<String> expressionWords = new ArrayList<>();
        double xMin = defaults.xMin();
        double xMax = defaults.xMax();
        double yMin = defaults.yMin();
        double yMax = defaults.yMax();
        int width = defaults.width();
        int height = defaults.height();
        boolean hasYMin = false;
        boolean hasYMax = false;

        for (String word : arguments.trim().split("\\s+")) {
            int colon = word.indexOf(':');
            String key = colon > 0 ? word.substring(0, colon).toLowerCase(Locale.ROOT) : "";
            String value = colon > 0 ? word.substring(colon + 1) : "";
            switch (key) {
                case "xmin" -> xMin = number(key, value);
                case "xmax" -> xMax = number(key, value);
                case "ymin" -> {
                    yMin = number(key, value);
                    hasYMin = true;
                }
                case "ymax" -> {
                    yMax = number(key, value);
                    hasYMax = true;
                }
                case "width" -> width = count(key, value);
                case "height" -> height = count(key, value);
                default -> {
                    if (!word.isEmpty()) {
                        expressionWords.add(word);
                    }
                }
            }
        }

        PlotSettings settings = defaults
                .withXRange(xMin, xMax)
                .withYRange(yMin, yMax)
                .withSize(width, height);
        return new PlotRequest(String.join(" ", expressionWords), settings, hasYMin && hasYMax);
    }

    private static double number(final String key, final String value) {
        try {
            return Double.parseDouble(value);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("option " + key + " needs a number but got '" + value + "'", e);
        }
    }

    private static int count(final String key, final String value) {
        try {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("option " + key + " needs a whole number but got '" + value + "'", e);
        }
    }
}
