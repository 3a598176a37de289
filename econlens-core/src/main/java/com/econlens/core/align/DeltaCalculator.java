package com.econlens.core.align;

import com.econlens.core.model.AlignedRow;
import com.econlens.core.model.DerivedMetric;

import java.util.ArrayList;
import java.util.List;

/**
 * Period-over-period and year-over-year changes on an aligned timeline.
 *
 * Lags are taken in rows, not calendar periods: the "previous period" is the
 * previous row even when the timeline has a gap. Percent changes divide by the
 * magnitude of the earlier value and are null when that value is null or zero.
 */
public final class DeltaCalculator {

    private DeltaCalculator() {}

    public static DerivedMetric computeDeltas(List<AlignedRow> rows, String seriesId, int atIndex, int periodsPerYear) {
        if (periodsPerYear < 1) {
            throw new IllegalArgumentException("periodsPerYear must be >= 1: " + periodsPerYear);
        }
        if (atIndex < 0 || atIndex >= rows.size()) {
            throw new IndexOutOfBoundsException("Row index " + atIndex + " outside 0.." + (rows.size() - 1));
        }

        Double current = rows.get(atIndex).value(seriesId);
        if (current == null) {
            return DerivedMetric.EMPTY;
        }

        Double previous = valueAt(rows, seriesId, atIndex - 1);
        Double yearAgo = valueAt(rows, seriesId, atIndex - periodsPerYear);

        return new DerivedMetric(
            current,
            difference(current, previous),
            percentChange(current, previous),
            difference(current, yearAgo),
            percentChange(current, yearAgo)
        );
    }

    /**
     * Metrics for every row of the timeline, same indexing as {@code rows}.
     */
    public static List<DerivedMetric> computeSeries(List<AlignedRow> rows, String seriesId, int periodsPerYear) {
        List<DerivedMetric> result = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            result.add(computeDeltas(rows, seriesId, i, periodsPerYear));
        }
        return result;
    }

    public static Double difference(Double current, Double reference) {
        if (current == null || reference == null) return null;
        return current - reference;
    }

    public static Double percentChange(Double current, Double reference) {
        if (current == null || reference == null || reference == 0.0) return null;
        double pct = (current - reference) / Math.abs(reference) * 100.0;
        return Double.isFinite(pct) ? pct : null;
    }

    private static Double valueAt(List<AlignedRow> rows, String seriesId, int index) {
        if (index < 0 || index >= rows.size()) return null;
        return rows.get(index).value(seriesId);
    }
}
