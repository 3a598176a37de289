package com.econlens.core.store;

import com.econlens.core.model.Observation;
import com.econlens.core.model.PeriodKey;

import java.io.IOException;
import java.util.List;

/**
 * Loads the observations of one series. Ordering of the result is not trusted.
 */
@FunctionalInterface
public interface SeriesFetcher {

    /**
     * @param seriesId   series identifier
     * @param rangeStart earliest period wanted, or null for the full history
     */
    List<Observation> fetch(String seriesId, PeriodKey rangeStart) throws IOException;
}
