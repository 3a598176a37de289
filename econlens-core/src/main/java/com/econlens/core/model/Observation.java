package com.econlens.core.model;

/**
 * One data point of a single series.
 *
 * @param periodKey period the value belongs to
 * @param label     display label supplied by the source, may be null
 * @param value     observed value, null when the source reports no value
 */
public record Observation(PeriodKey periodKey, String label, Double value) {

    public Observation {
        if (periodKey == null) {
            throw new IllegalArgumentException("periodKey must not be null");
        }
    }

    public static Observation of(PeriodKey periodKey, Double value) {
        return new Observation(periodKey, null, value);
    }

    public boolean hasValue() {
        return value != null;
    }
}
