package com.econlens.dataclient;

import com.econlens.core.catalog.IdentifierCatalog;
import com.econlens.core.context.ComparisonContext;
import com.econlens.core.context.ExplorerSettings;
import com.econlens.core.model.PeriodKey;
import com.econlens.core.store.ObservationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;

/**
 * One explorer page backed by the remote API: its catalog, its observation
 * store and its comparison context, all configured from the page's settings.
 */
public class ExplorerSession {
    private static final Logger log = LoggerFactory.getLogger(ExplorerSession.class);

    private final ExplorerSettings settings;
    private final ObservationStore store;
    private final IdentifierCatalog catalog;
    private final ComparisonContext context;

    /**
     * @param executor   where series fetches run
     * @param rangeStart earliest period fetched, null for full history
     */
    public ExplorerSession(ExplorerApiClient client, ExplorerSettings settings, Executor executor, PeriodKey rangeStart) {
        this.settings = settings;
        this.store = new ObservationStore(
            new RemoteSeriesFetcher(client, settings.source(), settings.survey()),
            executor, rangeStart, settings.excludeAnnualAverages());
        this.catalog = new IdentifierCatalog(new RemoteCatalogFetcher(client, settings.source(), settings.survey()));
        this.context = new ComparisonContext(settings, store);
        log.info("Opened explorer {} ({}/{}) against {}", settings.key(), settings.source(), settings.survey(),
            client.getConfig().getBaseUrl());
    }

    public ExplorerSettings getSettings() {
        return settings;
    }

    public ObservationStore getStore() {
        return store;
    }

    public IdentifierCatalog getCatalog() {
        return catalog;
    }

    public ComparisonContext getContext() {
        return context;
    }

    /**
     * Detach the context from the store; cached data stays available to callers holding the store.
     */
    public void close() {
        context.detach();
    }
}
