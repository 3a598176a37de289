package com.econlens.core.align;

import com.econlens.core.model.AlignedRow;
import com.econlens.core.model.PeriodKey;

import java.util.List;

/**
 * Range restrictions applied after alignment, so deltas near the start of a
 * window still see the history before it.
 */
public final class RowWindows {

    private RowWindows() {}

    /**
     * Rows at or after {@code start}. A null start returns the rows unchanged.
     */
    public static List<AlignedRow> from(List<AlignedRow> rows, PeriodKey start) {
        if (start == null || rows.isEmpty()) return rows;
        int lo = 0;
        int hi = rows.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (rows.get(mid).periodKey().compareTo(start) < 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return rows.subList(lo, rows.size());
    }

    /**
     * The most recent {@code count} rows; non-positive count means no limit.
     */
    public static List<AlignedRow> last(List<AlignedRow> rows, int count) {
        if (count <= 0 || rows.size() <= count) return rows;
        return rows.subList(rows.size() - count, rows.size());
    }

    /**
     * Index in {@code rows} of the first row kept by applying both {@link #from} and {@link #last}.
     */
    public static int startIndex(List<AlignedRow> rows, PeriodKey start, int lastCount) {
        int fromStart = rows.size() - from(rows, start).size();
        int fromCount = lastCount > 0 ? Math.max(0, rows.size() - lastCount) : 0;
        return Math.max(fromStart, fromCount);
    }
}
