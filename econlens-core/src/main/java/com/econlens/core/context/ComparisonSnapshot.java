package com.econlens.core.context;

import com.econlens.core.model.AlignedRow;
import com.econlens.core.model.DerivedMetric;
import com.econlens.core.model.PeriodKey;
import com.econlens.core.view.ChartRow;
import com.econlens.core.view.TableRow;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything a page renders for one state of its comparison, computed in one pass.
 *
 * @param seriesIds    selected series, in selection order
 * @param rows         visible aligned rows, ascending
 * @param activeIndex  index of the active row in {@code rows}, -1 when there is no data
 * @param frozen       true when the active row is a user-chosen historical period
 * @param metrics      metrics of each selected series at the active row
 * @param chart        chart view of {@code rows}
 * @param table        table view of {@code rows}
 * @param colors       colour of each selected series
 * @param pending      selected series still loading
 */
public record ComparisonSnapshot(
    List<String> seriesIds,
    List<AlignedRow> rows,
    int activeIndex,
    boolean frozen,
    Map<String, DerivedMetric> metrics,
    List<ChartRow> chart,
    List<TableRow> table,
    Map<String, String> colors,
    Set<String> pending
) {
    public boolean hasData() {
        return activeIndex >= 0;
    }

    public Optional<AlignedRow> activeRow() {
        return hasData() ? Optional.of(rows.get(activeIndex)) : Optional.empty();
    }

    public Optional<PeriodKey> activePeriod() {
        return activeRow().map(AlignedRow::periodKey);
    }

    public DerivedMetric metric(String seriesId) {
        return metrics.getOrDefault(seriesId, DerivedMetric.EMPTY);
    }
}
