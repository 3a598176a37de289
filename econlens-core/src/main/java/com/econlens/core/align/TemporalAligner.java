package com.econlens.core.align;

import com.econlens.core.model.AlignedRow;
import com.econlens.core.model.Observation;
import com.econlens.core.model.PeriodKey;
import com.econlens.core.model.PeriodNames;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Outer-joins several period-sorted series onto one calendar axis.
 *
 * Each input list must already be sorted ascending by period key
 * (ObservationStore guarantees this for everything it hands out).
 * Output has exactly one row per distinct key found in any input,
 * in strictly ascending order; series missing at a key get a null value.
 */
public final class TemporalAligner {

    private TemporalAligner() {}

    /**
     * Merge the series. Iteration order of {@code seriesMap} decides column order
     * and which label wins when sources disagree (first non-null wins).
     */
    public static List<AlignedRow> align(Map<String, List<Observation>> seriesMap) {
        List<String> ids = new ArrayList<>(seriesMap.keySet());
        List<List<Observation>> lists = new ArrayList<>(ids.size());
        for (String id : ids) {
            List<Observation> obs = seriesMap.get(id);
            lists.add(obs != null ? obs : List.of());
        }

        // Heap of per-series cursors ordered by current key, ties broken by series position
        PriorityQueue<Cursor> heap = new PriorityQueue<>(
            Comparator.comparing((Cursor c) -> c.current().periodKey()).thenComparingInt(Cursor::seriesIndex));
        int total = 0;
        for (int i = 0; i < lists.size(); i++) {
            total += lists.get(i).size();
            if (!lists.get(i).isEmpty()) {
                heap.add(new Cursor(i, lists.get(i), 0));
            }
        }

        List<AlignedRow> rows = new ArrayList<>(Math.max(16, total / Math.max(1, ids.size())));
        while (!heap.isEmpty()) {
            PeriodKey key = heap.peek().current().periodKey();

            Double[] values = new Double[ids.size()];
            String[] labels = new String[ids.size()];
            boolean[] seen = new boolean[ids.size()];
            while (!heap.isEmpty() && heap.peek().current().periodKey().equals(key)) {
                Cursor cursor = heap.poll();
                Observation obs = cursor.current();
                // Duplicate keys within one series: keep the first occurrence
                if (!seen[cursor.seriesIndex()]) {
                    seen[cursor.seriesIndex()] = true;
                    values[cursor.seriesIndex()] = obs.value();
                    labels[cursor.seriesIndex()] = obs.label();
                }
                Cursor next = cursor.advance();
                if (next != null) heap.add(next);
            }

            Map<String, Double> rowValues = new LinkedHashMap<>();
            String label = null;
            for (int i = 0; i < ids.size(); i++) {
                rowValues.put(ids.get(i), values[i]);
                if (label == null && labels[i] != null && !labels[i].isBlank()) {
                    label = labels[i];
                }
            }
            rows.add(new AlignedRow(key, label != null ? label : PeriodNames.displayName(key), rowValues));
        }
        return rows;
    }

    private record Cursor(int seriesIndex, List<Observation> observations, int position) {
        Observation current() {
            return observations.get(position);
        }

        Cursor advance() {
            return position + 1 < observations.size() ? new Cursor(seriesIndex, observations, position + 1) : null;
        }
    }
}
