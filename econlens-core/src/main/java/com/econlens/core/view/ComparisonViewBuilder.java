package com.econlens.core.view;

import com.econlens.core.align.DeltaCalculator;
import com.econlens.core.model.AlignedRow;
import com.econlens.core.model.DerivedMetric;
import com.econlens.core.selection.SelectionSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projects aligned rows into chart (wide) and table (tall) shapes.
 * Both come from the same rows so a chart and its table always agree.
 */
public final class ComparisonViewBuilder {

    private ComparisonViewBuilder() {}

    public static List<ChartRow> buildChartView(List<AlignedRow> rows, SelectionSet selection) {
        return buildChartView(rows, selection.ids());
    }

    /**
     * One row per period, fields in selection order.
     */
    public static List<ChartRow> buildChartView(List<AlignedRow> rows, List<String> seriesIds) {
        List<ChartRow> chart = new ArrayList<>(rows.size());
        for (AlignedRow row : rows) {
            Map<String, Double> values = new LinkedHashMap<>();
            for (String id : seriesIds) {
                values.put(id, row.value(id));
            }
            chart.add(new ChartRow(row.periodKey(), row.label(), values));
        }
        return chart;
    }

    public static List<TableRow> buildTableView(List<AlignedRow> rows, SelectionSet selection, TableOrder order) {
        return buildTableView(rows, selection.ids(), order, 0);
    }

    public static List<TableRow> buildTableView(List<AlignedRow> rows, SelectionSet selection, TableOrder order,
                                                int periodsPerYear) {
        return buildTableView(rows, selection.ids(), order, periodsPerYear);
    }

    /**
     * One row per (period, series). Within a period, series follow selection order.
     *
     * @param periodsPerYear when positive, each row carries its deltas; otherwise {@link DerivedMetric#EMPTY}
     */
    public static List<TableRow> buildTableView(List<AlignedRow> rows, List<String> seriesIds, TableOrder order,
                                                int periodsPerYear) {
        Map<String, List<DerivedMetric>> metrics = new LinkedHashMap<>();
        if (periodsPerYear > 0) {
            for (String id : seriesIds) {
                metrics.put(id, DeltaCalculator.computeSeries(rows, id, periodsPerYear));
            }
        }

        List<TableRow> table = new ArrayList<>(rows.size() * Math.max(1, seriesIds.size()));
        for (int n = 0; n < rows.size(); n++) {
            int i = order == TableOrder.REVERSE ? rows.size() - 1 - n : n;
            AlignedRow row = rows.get(i);
            for (String id : seriesIds) {
                DerivedMetric metric = periodsPerYear > 0 ? metrics.get(id).get(i) : DerivedMetric.EMPTY;
                table.add(new TableRow(row.periodKey(), row.label(), id, row.value(id), metric));
            }
        }
        return table;
    }
}
