package com.econlens.charts;

import com.econlens.core.context.ComparisonSnapshot;
import com.econlens.core.model.DerivedMetric;
import org.jfree.data.category.DefaultCategoryDataset;

import java.util.Set;

/**
 * Bar chart data for the active row: period and year changes per selected series.
 */
public final class DeltaDatasetFactory {

    public static final String PERIOD_CHANGE = "Period change";
    public static final String YEAR_CHANGE = "Year change";

    private DeltaDatasetFactory() {}

    public static DefaultCategoryDataset create(ComparisonSnapshot snapshot) {
        return create(snapshot, Set.of());
    }

    /**
     * @param percentUnitIds series measured in percent; their bars show point changes
     */
    public static DefaultCategoryDataset create(ComparisonSnapshot snapshot, Set<String> percentUnitIds) {
        DefaultCategoryDataset dataset = new DefaultCategoryDataset();
        for (String id : snapshot.seriesIds()) {
            DerivedMetric metric = snapshot.metric(id);
            boolean percentUnit = percentUnitIds.contains(id);
            Double period = metric.headlinePeriodChange(percentUnit);
            Double year = metric.headlineYearChange(percentUnit);
            if (period != null) dataset.addValue(period, PERIOD_CHANGE, id);
            if (year != null) dataset.addValue(year, YEAR_CHANGE, id);
        }
        return dataset;
    }
}
