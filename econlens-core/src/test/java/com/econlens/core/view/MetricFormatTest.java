package com.econlens.core.view;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MetricFormat.
 */
class MetricFormatTest {

    @Test
    @DisplayName("Percent is signed with two decimals")
    void percent() {
        assertEquals("+2.00%", MetricFormat.percent(2.0));
        assertEquals("-0.40%", MetricFormat.percent(-0.4));
        assertEquals("+0.00%", MetricFormat.percent(0.0));
    }

    @Test
    @DisplayName("Absent or non-finite numbers render as N/A")
    void notAvailable() {
        assertEquals("N/A", MetricFormat.percent(null));
        assertEquals("N/A", MetricFormat.change(Double.NaN, 1));
        assertEquals("N/A", MetricFormat.value(Double.POSITIVE_INFINITY, 3));
    }

    @Test
    @DisplayName("Values use grouping separators")
    void grouping() {
        assertEquals("158,421.000", MetricFormat.value(158421.0, 3));
        assertEquals("+1.3", MetricFormat.change(1.25, 1));
    }

    @Test
    @DisplayName("Rounding is half-up and keeps null")
    void rounding() {
        assertEquals(2.35, MetricFormat.round(2.345, 2));
        assertNull(MetricFormat.round(null, 2));
    }
}
