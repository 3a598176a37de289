package com.econlens.core.align;

import com.econlens.core.model.AlignedRow;
import com.econlens.core.model.Observation;
import com.econlens.core.model.PeriodKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RowWindows.
 */
class RowWindowsTest {

    private static List<AlignedRow> months(int count) {
        List<Observation> obs = new ArrayList<>();
        for (int m = 1; m <= count; m++) obs.add(Observation.of(PeriodKey.month(2023, m), (double) m));
        return TemporalAligner.align(Map.of("S", obs));
    }

    @Test
    @DisplayName("from keeps rows at or after the start period")
    void from() {
        List<AlignedRow> rows = months(6);

        List<AlignedRow> window = RowWindows.from(rows, PeriodKey.month(2023, 4));

        assertEquals(3, window.size());
        assertEquals(PeriodKey.month(2023, 4), window.get(0).periodKey());
        assertSame(rows, RowWindows.from(rows, null));
    }

    @Test
    @DisplayName("from a start between rows begins at the next row")
    void fromBetweenRows() {
        List<AlignedRow> rows = months(6);

        List<AlignedRow> window = RowWindows.from(rows, PeriodKey.of(2022, "M13"));

        assertEquals(6, window.size());
        assertTrue(RowWindows.from(rows, PeriodKey.month(2024, 1)).isEmpty());
    }

    @Test
    @DisplayName("last keeps the most recent rows")
    void last() {
        List<AlignedRow> rows = months(6);

        assertEquals(2, RowWindows.last(rows, 2).size());
        assertEquals(6, RowWindows.last(rows, 0).size());
        assertEquals(6, RowWindows.last(rows, 10).size());
    }

    @Test
    @DisplayName("startIndex applies the tighter of both limits")
    void startIndex() {
        List<AlignedRow> rows = months(6);

        assertEquals(0, RowWindows.startIndex(rows, null, 0));
        assertEquals(3, RowWindows.startIndex(rows, PeriodKey.month(2023, 4), 0));
        assertEquals(4, RowWindows.startIndex(rows, PeriodKey.month(2023, 2), 2));
        assertEquals(4, RowWindows.startIndex(rows, PeriodKey.month(2023, 5), 3));
    }
}
