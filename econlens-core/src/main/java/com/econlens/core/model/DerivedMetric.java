package com.econlens.core.model;

/**
 * Metrics for one series relative to one aligned row.
 * Every component is null when it cannot be computed.
 */
public record DerivedMetric(
    Double latest,
    Double periodChangeAbs,
    Double periodChangePct,
    Double yearChangeAbs,
    Double yearChangePct
) {
    public static final DerivedMetric EMPTY = new DerivedMetric(null, null, null, null, null);

    public boolean hasLatest() {
        return latest != null;
    }

    /**
     * Change to headline for the period: percentage points for series already
     * measured in percent, percent change otherwise.
     */
    public Double headlinePeriodChange(boolean percentUnit) {
        return percentUnit ? periodChangeAbs : periodChangePct;
    }

    /**
     * Year-over-year counterpart of {@link #headlinePeriodChange(boolean)}.
     */
    public Double headlineYearChange(boolean percentUnit) {
        return percentUnit ? yearChangeAbs : yearChangePct;
    }
}
