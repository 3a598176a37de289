package com.econlens.core.context;

import com.econlens.core.model.Periodicity;
import com.econlens.core.selection.SeriesPalette;
import com.econlens.core.view.TableOrder;

import java.util.List;

/**
 * Per-page configuration of a comparison: what it compares and how.
 *
 * @param key                   preset key, e.g. "cu"
 * @param name                  display name
 * @param source                backend family ("bls", "bea", "fred")
 * @param survey                survey or dataset code within the source
 * @param periodicity           periodicity shared by the compared series
 * @param capacity              maximum number of selected series
 * @param palette               chart colours, assigned by selection position
 * @param lastPeriods           default visible window in periods, 0 for everything
 * @param excludeAnnualAverages drop M13/Q05/S03 observations when loading
 * @param tableOrder            row order of the comparison table
 * @param defaultSeries         series selected when the page opens
 */
public record ExplorerSettings(
    String key,
    String name,
    String source,
    String survey,
    Periodicity periodicity,
    int capacity,
    SeriesPalette palette,
    int lastPeriods,
    boolean excludeAnnualAverages,
    TableOrder tableOrder,
    List<String> defaultSeries
) {
    public static final int DEFAULT_CAPACITY = 5;

    public ExplorerSettings {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Explorer key is required");
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        }
        if (lastPeriods < 0) {
            throw new IllegalArgumentException("lastPeriods must be >= 0: " + lastPeriods);
        }
        if (periodicity == null) periodicity = Periodicity.MONTHLY;
        if (palette == null) palette = SeriesPalette.DEFAULT;
        if (tableOrder == null) tableOrder = TableOrder.REVERSE;
        defaultSeries = defaultSeries == null ? List.of() : List.copyOf(defaultSeries);
    }

    public int periodsPerYear() {
        return periodicity.periodsPerYear();
    }

    public static Builder builder(String key) {
        return new Builder(key);
    }

    public Builder toBuilder() {
        return new Builder(key)
            .name(name).source(source).survey(survey).periodicity(periodicity)
            .capacity(capacity).palette(palette).lastPeriods(lastPeriods)
            .excludeAnnualAverages(excludeAnnualAverages).tableOrder(tableOrder)
            .defaultSeries(defaultSeries);
    }

    public static class Builder {
        private final String key;
        private String name;
        private String source = "bls";
        private String survey;
        private Periodicity periodicity = Periodicity.MONTHLY;
        private int capacity = DEFAULT_CAPACITY;
        private SeriesPalette palette = SeriesPalette.DEFAULT;
        private int lastPeriods;
        private boolean excludeAnnualAverages = true;
        private TableOrder tableOrder = TableOrder.REVERSE;
        private List<String> defaultSeries = List.of();

        private Builder(String key) {
            this.key = key;
            this.name = key;
            this.survey = key;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder source(String source) { this.source = source; return this; }
        public Builder survey(String survey) { this.survey = survey; return this; }
        public Builder periodicity(Periodicity periodicity) { this.periodicity = periodicity; return this; }
        public Builder capacity(int capacity) { this.capacity = capacity; return this; }
        public Builder palette(SeriesPalette palette) { this.palette = palette; return this; }
        public Builder lastPeriods(int lastPeriods) { this.lastPeriods = lastPeriods; return this; }
        public Builder excludeAnnualAverages(boolean exclude) { this.excludeAnnualAverages = exclude; return this; }
        public Builder tableOrder(TableOrder tableOrder) { this.tableOrder = tableOrder; return this; }
        public Builder defaultSeries(List<String> defaultSeries) { this.defaultSeries = defaultSeries; return this; }

        public ExplorerSettings build() {
            return new ExplorerSettings(key, name, source, survey, periodicity, capacity, palette,
                lastPeriods, excludeAnnualAverages, tableOrder, defaultSeries);
        }
    }
}
