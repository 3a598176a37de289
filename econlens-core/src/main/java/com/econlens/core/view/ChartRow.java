package com.econlens.core.view;

import com.econlens.core.model.PeriodKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One point on the comparison chart's x axis, one field per selected series
 * (null where the series has no value).
 */
public record ChartRow(PeriodKey periodKey, String label, Map<String, Double> values) {

    public ChartRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Double value(String seriesId) {
        return values.get(seriesId);
    }

    public int sortKey() {
        return periodKey.sortKey();
    }
}
