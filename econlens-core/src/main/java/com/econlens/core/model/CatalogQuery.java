package com.econlens.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Query against the series catalog.
 *
 * @param keyword    case-insensitive substring to search for, null for none
 * @param dimensions equality filters; blank values are dropped
 * @param offset     zero-based index of the first item
 * @param limit      maximum number of items
 * @param activeOnly restrict to series still being published
 */
public record CatalogQuery(
    String keyword,
    Map<String, String> dimensions,
    int offset,
    int limit,
    boolean activeOnly
) {
    public static final int MAX_LIMIT = 1000;

    public CatalogQuery {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0: " + offset);
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be within 1.." + MAX_LIMIT + ": " + limit);
        }
        keyword = keyword == null || keyword.isBlank() ? null : keyword.trim();
        Map<String, String> cleaned = new LinkedHashMap<>();
        if (dimensions != null) {
            dimensions.forEach((k, v) -> {
                if (k != null && v != null && !v.isBlank()) cleaned.put(k, v.trim());
            });
        }
        dimensions = Collections.unmodifiableMap(cleaned);
    }

    public boolean hasKeyword() {
        return keyword != null;
    }
}
