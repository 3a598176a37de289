package com.econlens.dataclient;

import com.econlens.core.catalog.CatalogDimensions;
import com.econlens.core.catalog.CatalogFetcher;
import com.econlens.core.model.CatalogPage;
import com.econlens.core.model.CatalogQuery;

import java.io.IOException;

/**
 * Catalog of one survey served by the explorer backend.
 * The dimension outline rarely changes, so it is fetched once and kept.
 */
public class RemoteCatalogFetcher implements CatalogFetcher {

    private final ExplorerApiClient client;
    private final String source;
    private final String survey;

    private volatile CatalogDimensions dimensions;

    public RemoteCatalogFetcher(ExplorerApiClient client, String source, String survey) {
        this.client = client;
        this.source = source;
        this.survey = survey;
    }

    @Override
    public CatalogPage fetch(CatalogQuery query) throws IOException {
        return client.listSeries(source, survey, query);
    }

    @Override
    public CatalogDimensions dimensions() throws IOException {
        CatalogDimensions cached = dimensions;
        if (cached == null) {
            cached = client.getDimensions(source, survey);
            dimensions = cached;
        }
        return cached;
    }
}
