package org.kidoni.cas.op;

import java.math.BigDecimal;
import java.math.MathContext;

public final class Numerals {
    private static final MathContext DISPLAY_PRECISION = new MathContext(6);

    private Numerals() {
    }

    /**
     * Integral values print without a fraction, everything else with at most six significant
     * digits. Negative zero prints as {@code 0}.
     */
    public static String format(final double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        if (value == 0.0) {
            return "0";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }

        BigDecimal rounded = new BigDecimal(value).round(DISPLAY_PRECISION).stripTrailingZeros();
        double magnitude = Math.abs(value);
        if (magnitude >= 1e-4 && magnitude < 1e15) {
            return rounded.toPlainString();
        }
        return rounded.toString();
    }
}
