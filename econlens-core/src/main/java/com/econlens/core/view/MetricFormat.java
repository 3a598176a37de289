package com.econlens.core.view;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Display formatting for values and changes; absent numbers render as "N/A".
 */
public final class MetricFormat {

    public static final String NOT_AVAILABLE = "N/A";

    private MetricFormat() {}

    /**
     * Signed percent with two decimals: "+2.00%", "-0.40%".
     */
    public static String percent(Double value) {
        if (value == null || !Double.isFinite(value)) return NOT_AVAILABLE;
        String sign = value >= 0 ? "+" : "";
        return sign + String.format(Locale.ROOT, "%.2f", value) + "%";
    }

    /**
     * Signed absolute change: "+1.250", "-0.300".
     */
    public static String change(Double value, int decimals) {
        if (value == null || !Double.isFinite(value)) return NOT_AVAILABLE;
        String sign = value >= 0 ? "+" : "";
        return sign + String.format(Locale.ROOT, "%." + decimals + "f", value);
    }

    public static String value(Double value, int decimals) {
        if (value == null || !Double.isFinite(value)) return NOT_AVAILABLE;
        return String.format(Locale.ROOT, "%,." + decimals + "f", value);
    }

    /**
     * Round half-up to the given decimals, keeping null.
     */
    public static Double round(Double value, int decimals) {
        if (value == null || !Double.isFinite(value)) return value;
        return BigDecimal.valueOf(value)
            .setScale(decimals, RoundingMode.HALF_UP)
            .doubleValue();
    }
}
