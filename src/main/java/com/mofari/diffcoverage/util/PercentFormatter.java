package com.mofari.diffcoverage.util;

import java.math.BigDecimal;

public final class PercentFormatter {

    private PercentFormatter() {
    }

    public static String formatPercent(double percentage) {
        return formatPercent(percentage, 1);
    }

    /**
     * Rounds to {@code decimals} places and drops trailing zeros: 66.666 becomes "66.7%", 100.0 becomes "100%".
     */
    public static String formatPercent(double percentage, int decimals) {
        double scale = Math.pow(10, decimals);
        double rounded = Math.round(percentage * scale) / scale;
        if (rounded == Math.rint(rounded)) {
            return String.format("%d%%", (long) rounded);
        }
        return BigDecimal.valueOf(rounded).stripTrailingZeros().toPlainString() + "%";
    }
}
