package com.econlens.core.view;

import com.econlens.core.model.DerivedMetric;
import com.econlens.core.model.PeriodKey;

/**
 * One (period, series) cell of the comparison table.
 * {@code metric} is {@link DerivedMetric#EMPTY} when the table was built without deltas.
 */
public record TableRow(PeriodKey periodKey, String label, String seriesId, Double value, DerivedMetric metric) {

    public String formattedValue() {
        return MetricFormat.value(value, 3);
    }

    public String formattedPeriodChange() {
        return MetricFormat.percent(metric.periodChangePct());
    }

    public String formattedYearChange() {
        return MetricFormat.percent(metric.yearChangePct());
    }
}
