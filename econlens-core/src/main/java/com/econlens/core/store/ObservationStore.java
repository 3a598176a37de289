package com.econlens.core.store;

import com.econlens.core.model.Observation;
import com.econlens.core.model.PeriodKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;

/**
 * Session cache of fetched series, one sorted observation list per identifier.
 *
 * Entries are created on the first successful fetch and never evicted. Fetches run
 * on the supplied executor and never block the caller; concurrent requests for the
 * same series share one in-flight load. A failed load is logged, reported to
 * listeners and not cached, so the next request retries it. Loads that complete
 * after their series was deselected are kept.
 *
 * Lists are sorted by period and de-duplicated here, once, so the aligner can
 * merge them without re-sorting.
 */
public class ObservationStore {

    private static final Logger log = LoggerFactory.getLogger(ObservationStore.class);

    private final SeriesFetcher fetcher;
    private final Executor executor;
    private final PeriodKey rangeStart;
    private final boolean excludeAnnualAverages;

    private final Map<String, List<Observation>> cache = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<List<Observation>>> inFlight = new ConcurrentHashMap<>();
    private final List<StoreListener> listeners = new CopyOnWriteArrayList<>();

    public ObservationStore(SeriesFetcher fetcher) {
        this(fetcher, ForkJoinPool.commonPool(), null, false);
    }

    /**
     * @param fetcher               data source
     * @param executor              where fetches run
     * @param rangeStart            earliest period requested from the source, null for all
     * @param excludeAnnualAverages drop M13/Q05/S03 pseudo-periods at load time
     */
    public ObservationStore(SeriesFetcher fetcher, Executor executor, PeriodKey rangeStart, boolean excludeAnnualAverages) {
        this.fetcher = fetcher;
        this.executor = executor;
        this.rangeStart = rangeStart;
        this.excludeAnnualAverages = excludeAnnualAverages;
    }

    public void addListener(StoreListener listener) {
        listeners.add(listener);
    }

    public void removeListener(StoreListener listener) {
        listeners.remove(listener);
    }

    /**
     * Load a series if it is not cached yet. Completes immediately for cached series.
     * The returned future fails if the fetch fails.
     */
    public CompletableFuture<List<Observation>> request(String seriesId) {
        List<Observation> cached = cache.get(seriesId);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        CompletableFuture<List<Observation>> promise = new CompletableFuture<>();
        CompletableFuture<List<Observation>> existing = inFlight.putIfAbsent(seriesId, promise);
        if (existing != null) {
            return existing;
        }
        cached = cache.get(seriesId);
        if (cached != null) {
            // Another load finished between the two lookups
            inFlight.remove(seriesId, promise);
            promise.complete(cached);
            return promise;
        }
        log.debug("Fetching series {} (from {})", seriesId, rangeStart);
        try {
            executor.execute(() -> load(seriesId, promise));
        } catch (RejectedExecutionException e) {
            fail(seriesId, promise, e);
        }
        return promise;
    }

    /**
     * Request every series in order; returns a future completing when all have settled.
     */
    public CompletableFuture<Void> requestAll(Collection<String> seriesIds) {
        CompletableFuture<?>[] futures = seriesIds.stream()
            .map(id -> request(id).exceptionally(e -> List.of()))
            .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(futures);
    }

    private void load(String seriesId, CompletableFuture<List<Observation>> promise) {
        List<Observation> observations;
        try {
            observations = normalize(fetcher.fetch(seriesId, rangeStart));
        } catch (Throwable e) {
            // Errors too, otherwise the in-flight entry would never clear
            fail(seriesId, promise, e);
            return;
        }
        // Publish to the cache before leaving the in-flight map so there is no window with neither
        List<Observation> stored = cache.putIfAbsent(seriesId, observations);
        List<Observation> result = stored != null ? stored : observations;
        inFlight.remove(seriesId, promise);
        log.debug("Loaded {} observations for {}", result.size(), seriesId);
        for (StoreListener l : listeners) {
            try {
                l.onSeriesLoaded(seriesId, result.size());
            } catch (RuntimeException e) {
                log.error("Store listener failed for {}", seriesId, e);
            }
        }
        promise.complete(result);
    }

    private void fail(String seriesId, CompletableFuture<List<Observation>> promise, Throwable error) {
        inFlight.remove(seriesId, promise);
        log.warn("Failed to load series {}: {}", seriesId, error.getMessage());
        for (StoreListener l : listeners) {
            try {
                l.onSeriesFailed(seriesId, error);
            } catch (RuntimeException e) {
                log.error("Store listener failed for {}", seriesId, e);
            }
        }
        promise.completeExceptionally(error);
    }

    /**
     * Cached observations, or an empty list if the series has not (successfully) loaded.
     */
    public List<Observation> get(String seriesId) {
        return cache.getOrDefault(seriesId, List.of());
    }

    public boolean isLoaded(String seriesId) {
        return cache.containsKey(seriesId);
    }

    public boolean isLoading(String seriesId) {
        return inFlight.containsKey(seriesId);
    }

    public Set<String> loadedIds() {
        return Set.copyOf(cache.keySet());
    }

    /**
     * Current data for the given series in the given order, empty lists for series not loaded.
     * This is the aligner's input.
     */
    public Map<String, List<Observation>> snapshot(Collection<String> seriesIds) {
        Map<String, List<Observation>> result = new LinkedHashMap<>();
        for (String id : seriesIds) {
            result.put(id, get(id));
        }
        return result;
    }

    /**
     * Sort by period, keep the first observation per period, optionally drop annual averages.
     */
    List<Observation> normalize(List<Observation> raw) {
        if (raw == null || raw.isEmpty()) return List.of();
        List<Observation> sorted = new ArrayList<>(raw.size());
        for (Observation o : raw) {
            if (o == null) continue;
            if (excludeAnnualAverages && o.periodKey().isAnnualAverage()) continue;
            sorted.add(o);
        }
        // Stable sort keeps source order among duplicates
        sorted.sort(Comparator.comparing(Observation::periodKey));
        List<Observation> unique = new ArrayList<>(sorted.size());
        PeriodKey last = null;
        for (Observation o : sorted) {
            if (!o.periodKey().equals(last)) {
                unique.add(o);
                last = o.periodKey();
            }
        }
        return List.copyOf(unique);
    }
}
