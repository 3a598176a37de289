package com.econlens.core.model;

import java.util.List;

/**
 * One page of catalog results. A failed fetch yields an empty page with {@code error} set.
 */
public record CatalogPage(int total, List<SeriesInfo> items, int offset, int limit, String error) {

    public CatalogPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static CatalogPage of(int total, List<SeriesInfo> items, int offset, int limit) {
        return new CatalogPage(total, items, offset, limit, null);
    }

    public static CatalogPage failed(CatalogQuery query, String error) {
        return new CatalogPage(0, List.of(), query.offset(), query.limit(),
            error != null ? error : "Catalog request failed");
    }

    public boolean isError() {
        return error != null;
    }

    public boolean hasMore() {
        return offset + items.size() < total;
    }

    /**
     * Offset of the following page, or -1 when this is the last one.
     */
    public int nextOffset() {
        return hasMore() ? offset + limit : -1;
    }
}
