package com.econlens.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One period of a comparison: the value of every contributing series at that period.
 * Series without an observation at the period map to null. Immutable.
 */
public record AlignedRow(PeriodKey periodKey, String label, Map<String, Double> values) {

    public AlignedRow {
        if (periodKey == null) {
            throw new IllegalArgumentException("periodKey must not be null");
        }
        // Map.copyOf rejects null values, absent entries are nulls here
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Value for a series, or null if absent or not part of the comparison.
     */
    public Double value(String seriesId) {
        return values.get(seriesId);
    }

    public boolean hasValue(String seriesId) {
        return values.get(seriesId) != null;
    }

    /**
     * True when at least one of the given series has a value in this row.
     * A null collection means every series in the row.
     */
    public boolean hasAnyValue(Collection<String> seriesIds) {
        Collection<String> ids = seriesIds != null ? seriesIds : values.keySet();
        for (String id : ids) {
            if (values.get(id) != null) return true;
        }
        return false;
    }
}
