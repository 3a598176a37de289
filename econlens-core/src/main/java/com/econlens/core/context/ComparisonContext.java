package com.econlens.core.context;

import com.econlens.core.align.DeltaCalculator;
import com.econlens.core.align.NoDataException;
import com.econlens.core.align.PeriodNotFoundException;
import com.econlens.core.align.PeriodSelector;
import com.econlens.core.align.RowWindows;
import com.econlens.core.align.TemporalAligner;
import com.econlens.core.model.AlignedRow;
import com.econlens.core.model.DerivedMetric;
import com.econlens.core.model.PeriodKey;
import com.econlens.core.selection.SelectionSet;
import com.econlens.core.store.ObservationStore;
import com.econlens.core.store.StoreListener;
import com.econlens.core.view.ChartRow;
import com.econlens.core.view.ComparisonViewBuilder;
import com.econlens.core.view.TableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One comparison on one explorer page: which series are selected, whether metrics
 * are live or frozen at a historical period, and which range is visible.
 *
 * Nothing is patched incrementally. Every {@link #snapshot()} re-aligns whatever the
 * store currently holds for the selection, so partial data renders as it arrives.
 */
public class ComparisonContext implements StoreListener {

    private static final Logger log = LoggerFactory.getLogger(ComparisonContext.class);

    private final ExplorerSettings settings;
    private final ObservationStore store;
    private final List<ComparisonListener> listeners = new CopyOnWriteArrayList<>();

    private SelectionSet selection;
    private PeriodKey frozenPeriod;
    private PeriodKey rangeStart;
    private int lastPeriods;

    public ComparisonContext(ExplorerSettings settings, ObservationStore store) {
        this.settings = settings;
        this.store = store;
        this.selection = SelectionSet.empty(settings.capacity());
        this.lastPeriods = settings.lastPeriods();
        store.addListener(this);
    }

    /**
     * Select the preset's default series and start loading them.
     */
    public void selectDefaults() {
        synchronized (this) {
            selection = SelectionSet.of(settings.capacity(), settings.defaultSeries());
        }
        store.requestAll(selection.ids());
        fireChanged();
    }

    public ExplorerSettings getSettings() {
        return settings;
    }

    public ObservationStore getStore() {
        return store;
    }

    // ==================== Selection ====================

    /**
     * Add or remove a series. Adding to a full selection does nothing.
     * A newly added series is fetched if the store does not have it yet.
     *
     * @return the selection after the toggle
     */
    public SelectionSet toggle(String seriesId) {
        SelectionSet before;
        SelectionSet after;
        synchronized (this) {
            before = selection;
            after = before.toggle(seriesId);
            selection = after;
        }
        if (after == before) {
            log.debug("Selection full ({}), ignoring {}", after.capacity(), seriesId);
            return after;
        }
        if (after.contains(seriesId)) {
            store.request(seriesId);
        }
        fireChanged();
        return after;
    }

    public void clearSelection() {
        synchronized (this) {
            if (selection.isEmpty()) return;
            selection = selection.clear();
        }
        fireChanged();
    }

    public synchronized SelectionSet getSelection() {
        return selection;
    }

    public synchronized boolean isAtCapacity() {
        return selection.isAtCapacity();
    }

    /**
     * Colour of a selected series, null if it is not selected.
     */
    public synchronized String colorOf(String seriesId) {
        return settings.palette().colorOf(selection, seriesId);
    }

    // ==================== Time travel ====================

    /**
     * Freeze all metrics at {@code period} instead of the latest row.
     */
    public void freezeAt(PeriodKey period) {
        synchronized (this) {
            frozenPeriod = period;
        }
        fireChanged();
    }

    /**
     * Return to live mode (latest row with data).
     */
    public void goLive() {
        synchronized (this) {
            if (frozenPeriod == null) return;
            frozenPeriod = null;
        }
        fireChanged();
    }

    public synchronized boolean isFrozen() {
        return frozenPeriod != null;
    }

    public synchronized PeriodKey getFrozenPeriod() {
        return frozenPeriod;
    }

    // ==================== Range ====================

    /**
     * Hide rows before {@code start}; null shows the full history.
     */
    public void setRangeStart(PeriodKey start) {
        synchronized (this) {
            rangeStart = start;
        }
        fireChanged();
    }

    /**
     * Show only the most recent {@code count} rows; 0 shows everything.
     */
    public void setLastPeriods(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0: " + count);
        }
        synchronized (this) {
            lastPeriods = count;
        }
        fireChanged();
    }

    public synchronized PeriodKey getRangeStart() {
        return rangeStart;
    }

    public synchronized int getLastPeriods() {
        return lastPeriods;
    }

    // ==================== Derived state ====================

    /**
     * Align, resolve and project the current state.
     * A frozen period that is no longer in the visible timeline is dropped and
     * the snapshot falls back to live mode.
     */
    public ComparisonSnapshot snapshot() {
        SelectionSet sel;
        PeriodKey frozen;
        PeriodKey start;
        int last;
        synchronized (this) {
            sel = selection;
            frozen = frozenPeriod;
            start = rangeStart;
            last = lastPeriods;
        }
        List<String> ids = sel.ids();
        int periodsPerYear = settings.periodsPerYear();

        // Deltas are computed on the full history, windowing only hides rows
        List<AlignedRow> all = TemporalAligner.align(store.snapshot(ids));
        int offset = RowWindows.startIndex(all, start, last);
        List<AlignedRow> visible = all.subList(offset, all.size());

        int active = resolveActive(visible, frozen, ids);
        boolean isFrozen = active >= 0 && frozen != null && visible.get(active).periodKey().equals(frozen);

        Map<String, DerivedMetric> metrics = new LinkedHashMap<>();
        for (String id : ids) {
            metrics.put(id, active >= 0
                ? DeltaCalculator.computeDeltas(all, id, offset + active, periodsPerYear)
                : DerivedMetric.EMPTY);
        }

        List<ChartRow> chart = ComparisonViewBuilder.buildChartView(visible, ids);
        List<TableRow> table = ComparisonViewBuilder.buildTableView(all, ids, settings.tableOrder(), periodsPerYear);
        if (offset > 0) {
            PeriodKey firstVisible = visible.isEmpty() ? null : visible.get(0).periodKey();
            table = table.stream()
                .filter(r -> firstVisible != null && r.periodKey().compareTo(firstVisible) >= 0)
                .toList();
        }

        Map<String, String> colors = new LinkedHashMap<>();
        Set<String> pending = new LinkedHashSet<>();
        for (String id : ids) {
            colors.put(id, settings.palette().colorOf(sel, id));
            if (store.isLoading(id)) pending.add(id);
        }

        return new ComparisonSnapshot(ids, List.copyOf(visible), active, isFrozen,
            metrics, chart, table, colors, pending);
    }

    /**
     * Metrics of one series for every visible row (sparklines, history tables).
     */
    public List<DerivedMetric> seriesMetrics(String seriesId) {
        SelectionSet sel;
        PeriodKey start;
        int last;
        synchronized (this) {
            sel = selection;
            start = rangeStart;
            last = lastPeriods;
        }
        List<AlignedRow> all = TemporalAligner.align(store.snapshot(sel.ids()));
        int offset = RowWindows.startIndex(all, start, last);
        List<DerivedMetric> metrics = DeltaCalculator.computeSeries(all, seriesId, settings.periodsPerYear());
        return metrics.subList(offset, metrics.size());
    }

    private int resolveActive(List<AlignedRow> rows, PeriodKey frozen, List<String> ids) {
        if (frozen != null) {
            try {
                return PeriodSelector.resolve(rows, frozen, ids);
            } catch (PeriodNotFoundException e) {
                log.warn("Frozen period {} not in timeline, returning to live mode", frozen);
                synchronized (this) {
                    if (frozen.equals(frozenPeriod)) frozenPeriod = null;
                }
            }
        }
        try {
            return PeriodSelector.resolve(rows, null, ids);
        } catch (NoDataException e) {
            return -1;
        }
    }

    // ==================== Listeners ====================

    public void addListener(ComparisonListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ComparisonListener listener) {
        listeners.remove(listener);
    }

    /**
     * Stop receiving store events. The store and its cache stay usable.
     */
    public void detach() {
        store.removeListener(this);
        listeners.clear();
    }

    @Override
    public void onSeriesLoaded(String seriesId, int observationCount) {
        if (getSelection().contains(seriesId)) {
            fireChanged();
        }
    }

    @Override
    public void onSeriesFailed(String seriesId, Throwable error) {
        if (getSelection().contains(seriesId)) {
            fireChanged();
        }
    }

    private void fireChanged() {
        for (ComparisonListener l : listeners) {
            try {
                l.onComparisonChanged(this);
            } catch (RuntimeException e) {
                log.error("Comparison listener failed", e);
            }
        }
    }
}
