package com.econlens.core.catalog;

import com.econlens.core.model.CatalogPage;
import com.econlens.core.model.CatalogQuery;
import com.econlens.core.model.SeriesInfo;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Catalog over a fixed list of series, ordered by identifier.
 * Keyword matches the id, title, unit and dimension codes/names, ignoring case.
 */
public class InMemoryCatalogFetcher implements CatalogFetcher {

    private final List<SeriesInfo> series;
    private final CatalogDimensions dimensions;

    public InMemoryCatalogFetcher(List<SeriesInfo> series) {
        this(series, CatalogDimensions.EMPTY);
    }

    public InMemoryCatalogFetcher(List<SeriesInfo> series, CatalogDimensions dimensions) {
        List<SeriesInfo> sorted = new ArrayList<>(series);
        sorted.sort(Comparator.comparing(SeriesInfo::id));
        this.series = List.copyOf(sorted);
        this.dimensions = dimensions;
    }

    @Override
    public CatalogPage fetch(CatalogQuery query) {
        List<SeriesInfo> matches = new ArrayList<>();
        String needle = query.hasKeyword() ? query.keyword().toLowerCase(Locale.ROOT) : null;
        for (SeriesInfo s : series) {
            if (query.activeOnly() && !s.active()) continue;
            if (!matchesDimensions(s, query.dimensions())) continue;
            if (needle != null && !matchesKeyword(s, needle)) continue;
            matches.add(s);
        }
        int from = Math.min(query.offset(), matches.size());
        int to = Math.min(from + query.limit(), matches.size());
        return CatalogPage.of(matches.size(), matches.subList(from, to), query.offset(), query.limit());
    }

    @Override
    public CatalogDimensions dimensions() {
        return dimensions;
    }

    private static boolean matchesDimensions(SeriesInfo s, Map<String, String> filters) {
        for (Map.Entry<String, String> f : filters.entrySet()) {
            if ("seasonal".equals(f.getKey())) {
                if (!f.getValue().equalsIgnoreCase(s.seasonallyAdjusted() ? "S" : "U")) return false;
                continue;
            }
            if (!f.getValue().equals(s.dimension(f.getKey()))) return false;
        }
        return true;
    }

    private static boolean matchesKeyword(SeriesInfo s, String needle) {
        if (contains(s.id(), needle) || contains(s.title(), needle) || contains(s.unit(), needle)) {
            return true;
        }
        for (String v : s.dimensions().values()) {
            if (contains(v, needle)) return true;
        }
        for (String v : s.dimensionNames().values()) {
            if (contains(v, needle)) return true;
        }
        return false;
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
