package com.econlens.core.catalog;

import com.econlens.core.model.CatalogPage;
import com.econlens.core.model.CatalogQuery;

import java.io.IOException;

/**
 * Source of catalog pages (a backend endpoint, a local list...).
 */
public interface CatalogFetcher {

    CatalogPage fetch(CatalogQuery query) throws IOException;

    /**
     * Categorical dimensions available for filtering. Sources without an outline return empty.
     */
    default CatalogDimensions dimensions() throws IOException {
        return CatalogDimensions.EMPTY;
    }
}
