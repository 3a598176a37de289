package com.econlens.core.catalog;

import com.econlens.core.model.DimensionOption;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Filterable dimensions of a catalog, each an outline of options ordered as published.
 * Hierarchy is implied by display level: an option's children are the options that
 * follow it one level deeper, up to the next option at its own level or above.
 */
public final class CatalogDimensions {

    public static final CatalogDimensions EMPTY = new CatalogDimensions(Map.of());

    private final Map<String, List<DimensionOption>> options;

    public CatalogDimensions(Map<String, List<DimensionOption>> options) {
        Map<String, List<DimensionOption>> copy = new LinkedHashMap<>();
        options.forEach((name, list) -> copy.put(name, List.copyOf(list)));
        this.options = Collections.unmodifiableMap(copy);
    }

    public Set<String> names() {
        return options.keySet();
    }

    public List<DimensionOption> options(String dimension) {
        return options.getOrDefault(dimension, List.of());
    }

    public boolean isEmpty() {
        return options.isEmpty();
    }

    /**
     * Options usable as filters: selectable, first occurrence of each code, by sort sequence.
     */
    public List<DimensionOption> selectable(String dimension) {
        Set<String> seen = new HashSet<>();
        List<DimensionOption> result = new ArrayList<>();
        for (DimensionOption o : options(dimension)) {
            if (o.selectable() && seen.add(o.code())) {
                result.add(o);
            }
        }
        result.sort(Comparator.comparingInt(DimensionOption::sortSequence));
        return result;
    }

    /**
     * Direct children of {@code code} in the outline; empty if the code is unknown or a leaf.
     */
    public List<DimensionOption> childrenOf(String dimension, String code) {
        List<DimensionOption> list = options(dimension);
        List<DimensionOption> children = new ArrayList<>();
        int parentLevel = -1;
        for (DimensionOption o : list) {
            if (parentLevel < 0) {
                if (o.code().equals(code)) parentLevel = o.displayLevel();
                continue;
            }
            if (o.displayLevel() <= parentLevel) break;
            if (o.displayLevel() == parentLevel + 1) children.add(o);
        }
        return children;
    }

    /**
     * Top-level options of a dimension.
     */
    public List<DimensionOption> roots(String dimension) {
        List<DimensionOption> list = options(dimension);
        if (list.isEmpty()) return List.of();
        int minLevel = list.stream().mapToInt(DimensionOption::displayLevel).min().orElse(0);
        return list.stream().filter(o -> o.displayLevel() == minLevel).toList();
    }
}
