package com.econlens.core.store;

/**
 * Notified from the fetching thread when a series load finishes.
 */
public interface StoreListener {

    void onSeriesLoaded(String seriesId, int observationCount);

    default void onSeriesFailed(String seriesId, Throwable error) {}
}
