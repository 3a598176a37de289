package com.econlens.core.catalog;

import com.econlens.core.model.CatalogPage;
import com.econlens.core.model.CatalogQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Search, filter and browse access to the universe of series identifiers.
 * Fetch failures never escape: they come back as an empty page with the error set,
 * and the same call can simply be repeated.
 */
public class IdentifierCatalog {

    private static final Logger log = LoggerFactory.getLogger(IdentifierCatalog.class);

    private final CatalogFetcher fetcher;
    private final boolean activeOnly;

    public IdentifierCatalog(CatalogFetcher fetcher) {
        this(fetcher, true);
    }

    public IdentifierCatalog(CatalogFetcher fetcher, boolean activeOnly) {
        this.fetcher = fetcher;
        this.activeOnly = activeOnly;
    }

    /**
     * Case-insensitive substring search over descriptive fields.
     */
    public CatalogPage search(String keyword, int limit) {
        return fetch(new CatalogQuery(keyword, Map.of(), 0, limit, activeOnly));
    }

    /**
     * AND of equality filters; blank values place no constraint.
     */
    public CatalogPage filter(Map<String, String> dimensions, int limit, int offset) {
        return fetch(new CatalogQuery(null, dimensions, offset, limit, activeOnly));
    }

    /**
     * Paginated listing for exhaustive browsing. Pages are not snapshot-isolated.
     */
    public CatalogPage browse(int offset, int limit, Map<String, String> filters) {
        return fetch(new CatalogQuery(null, filters, offset, limit, activeOnly));
    }

    public CatalogPage browse(int offset, int limit) {
        return browse(offset, limit, Map.of());
    }

    /**
     * Run an arbitrary query with the same error handling.
     */
    public CatalogPage fetch(CatalogQuery query) {
        try {
            CatalogPage page = fetcher.fetch(query);
            if (page == null) {
                return CatalogPage.failed(query, "Catalog returned no page");
            }
            return page;
        } catch (Exception e) {
            log.warn("Catalog query failed (keyword={}, filters={}, offset={}): {}",
                query.keyword(), query.dimensions(), query.offset(), e.getMessage());
            return CatalogPage.failed(query, e.getMessage());
        }
    }

    /**
     * Dimension outline for filter pickers; empty when the source cannot provide it.
     */
    public CatalogDimensions dimensions() {
        try {
            CatalogDimensions dims = fetcher.dimensions();
            return dims != null ? dims : CatalogDimensions.EMPTY;
        } catch (Exception e) {
            log.warn("Failed to load catalog dimensions: {}", e.getMessage());
            return CatalogDimensions.EMPTY;
        }
    }
}
