package com.econlens.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Catalog entry for a series identifier.
 * Descriptive only: alignment never looks at anything but {@link #id()}.
 *
 * @param id                 opaque series identifier, e.g. "CUSR0000SA0"
 * @param title              display name
 * @param unit               unit of measure (nullable)
 * @param periodicity        sampling frequency (nullable when the source does not say)
 * @param seasonallyAdjusted seasonal adjustment flag
 * @param dimensions         categorical fields, dimension name to code (e.g. area -> 0000)
 * @param dimensionNames     display names for the dimension codes, same keys
 * @param beginYear          first year with data (nullable)
 * @param endYear            last year with data (nullable)
 * @param active             whether the source still publishes the series
 */
public record SeriesInfo(
    String id,
    String title,
    String unit,
    Periodicity periodicity,
    boolean seasonallyAdjusted,
    Map<String, String> dimensions,
    Map<String, String> dimensionNames,
    Integer beginYear,
    Integer endYear,
    boolean active
) {
    public SeriesInfo {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Series id is required");
        }
        dimensions = dimensions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
        dimensionNames = dimensionNames == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(dimensionNames));
    }

    public static SeriesInfo of(String id, String title) {
        return new SeriesInfo(id, title, null, null, false, Map.of(), Map.of(), null, null, true);
    }

    public String dimension(String name) {
        return dimensions.get(name);
    }

    /**
     * Whether the series is measured in percent (rates, shares).
     */
    public boolean isPercentUnit() {
        return unit != null && unit.toLowerCase().contains("percent");
    }
}
