package com.econlens.core.align;

import com.econlens.core.model.AlignedRow;
import com.econlens.core.model.PeriodKey;

import java.util.Collection;
import java.util.List;

/**
 * Resolves which aligned row is active: a frozen, user-chosen period (time travel)
 * or the most recent row with data (live).
 */
public final class PeriodSelector {

    private PeriodSelector() {}

    /**
     * @param rows       aligned rows, ascending
     * @param explicit   frozen period, or null for live mode
     * @param seriesIds  series that count as "having data" in live mode; null means all
     * @return index into {@code rows}
     * @throws PeriodNotFoundException if {@code explicit} is not in the timeline
     * @throws NoDataException         if in live mode no row carries any value
     */
    public static int resolve(List<AlignedRow> rows, PeriodKey explicit, Collection<String> seriesIds) {
        if (explicit != null) {
            int idx = indexOf(rows, explicit);
            if (idx < 0) {
                throw new PeriodNotFoundException(explicit);
            }
            return idx;
        }
        for (int i = rows.size() - 1; i >= 0; i--) {
            if (rows.get(i).hasAnyValue(seriesIds)) {
                return i;
            }
        }
        throw new NoDataException();
    }

    public static int resolve(List<AlignedRow> rows, PeriodKey explicit) {
        return resolve(rows, explicit, null);
    }

    /**
     * Binary search for the row with the given key. Returns -1 when absent.
     */
    public static int indexOf(List<AlignedRow> rows, PeriodKey key) {
        int lo = 0;
        int hi = rows.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            int c = rows.get(mid).periodKey().compareTo(key);
            if (c < 0) {
                lo = mid + 1;
            } else if (c > 0) {
                hi = mid - 1;
            } else {
                return mid;
            }
        }
        return -1;
    }
}
