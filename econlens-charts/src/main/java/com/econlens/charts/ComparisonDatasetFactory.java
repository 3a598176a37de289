package com.econlens.charts;

import com.econlens.core.model.PeriodKey;
import com.econlens.core.view.ChartRow;
import org.jfree.data.time.Month;
import org.jfree.data.time.Quarter;
import org.jfree.data.time.RegularTimePeriod;
import org.jfree.data.time.TimeSeries;
import org.jfree.data.time.TimeSeriesCollection;
import org.jfree.data.time.Year;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Builds the JFreeChart dataset of a comparison chart: one time series per selected
 * series, in selection order, so series index i gets the i-th selection colour.
 */
public final class ComparisonDatasetFactory {

    private static final Logger log = LoggerFactory.getLogger(ComparisonDatasetFactory.class);

    private ComparisonDatasetFactory() {}

    public static TimeSeriesCollection create(List<ChartRow> chart, List<String> seriesIds) {
        return create(chart, seriesIds, Map.of());
    }

    /**
     * @param titles legend descriptions per series id; the id is used when absent
     */
    public static TimeSeriesCollection create(List<ChartRow> chart, List<String> seriesIds, Map<String, String> titles) {
        TimeSeriesCollection dataset = new TimeSeriesCollection();
        for (String id : seriesIds) {
            TimeSeries series = new TimeSeries(id);
            series.setDescription(titles.getOrDefault(id, id));
            for (ChartRow row : chart) {
                Double value = row.value(id);
                if (value == null) continue;
                RegularTimePeriod period = toTimePeriod(row.periodKey());
                if (period == null) continue;
                series.addOrUpdate(period, value);
            }
            dataset.addSeries(series);
        }
        log.debug("Built comparison dataset: {} series over {} periods", seriesIds.size(), chart.size());
        return dataset;
    }

    /**
     * Calendar period of a key; null for annual averages, which have no place on a time axis.
     * Half-years map to the month they start in.
     */
    public static RegularTimePeriod toTimePeriod(PeriodKey key) {
        if (key.isAnnualAverage()) {
            return null;
        }
        int pos = key.position();
        return switch (key.periodicity()) {
            case MONTHLY -> new Month(pos, key.year());
            case QUARTERLY -> new Quarter(pos, key.year());
            case SEMIANNUAL -> new Month(pos == 1 ? 1 : 7, key.year());
            case ANNUAL -> new Year(key.year());
        };
    }
}
