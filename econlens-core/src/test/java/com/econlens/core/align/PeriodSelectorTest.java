package com.econlens.core.align;

import com.econlens.core.model.AlignedRow;
import com.econlens.core.model.Observation;
import com.econlens.core.model.PeriodKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PeriodSelector live and frozen resolution.
 */
class PeriodSelectorTest {

    private List<AlignedRow> rows;

    @BeforeEach
    void setUp() {
        Map<String, List<Observation>> input = new LinkedHashMap<>();
        input.put("A", List.of(
            Observation.of(PeriodKey.month(2023, 1), 100.0),
            Observation.of(PeriodKey.month(2023, 2), 102.0)));
        input.put("B", List.of(
            Observation.of(PeriodKey.month(2023, 2), 50.0),
            Observation.of(PeriodKey.month(2023, 3), 51.0),
            Observation.of(PeriodKey.month(2023, 4), null)));
        rows = TemporalAligner.align(input);
    }

    @Test
    @DisplayName("Live mode picks the latest row with any value")
    void liveSkipsEmptyTrailingRows() {
        assertEquals(2, PeriodSelector.resolve(rows, null));
    }

    @Test
    @DisplayName("Live mode restricted to one series picks its latest value")
    void liveForSubset() {
        assertEquals(1, PeriodSelector.resolve(rows, null, List.of("A")));
    }

    @Test
    @DisplayName("Frozen period resolves to its row even without values")
    void frozen() {
        assertEquals(0, PeriodSelector.resolve(rows, PeriodKey.month(2023, 1)));
        assertEquals(3, PeriodSelector.resolve(rows, PeriodKey.month(2023, 4)));
    }

    @Test
    @DisplayName("Frozen period outside the timeline is reported, not clamped")
    void frozenNotFound() {
        PeriodKey missing = PeriodKey.month(2022, 7);

        PeriodNotFoundException e = assertThrows(PeriodNotFoundException.class,
            () -> PeriodSelector.resolve(rows, missing));

        assertEquals(missing, e.getPeriodKey());
    }

    @Test
    @DisplayName("No data anywhere raises NoDataException")
    void noData() {
        assertThrows(NoDataException.class, () -> PeriodSelector.resolve(List.of(), null));
        assertThrows(NoDataException.class, () -> PeriodSelector.resolve(rows, null, List.of("C")));
    }

    @Test
    @DisplayName("indexOf returns -1 for absent keys")
    void indexOf() {
        assertEquals(1, PeriodSelector.indexOf(rows, PeriodKey.month(2023, 2)));
        assertEquals(-1, PeriodSelector.indexOf(rows, PeriodKey.month(2023, 5)));
        assertEquals(-1, PeriodSelector.indexOf(List.of(), PeriodKey.month(2023, 5)));
    }
}
