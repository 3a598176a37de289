package com.econlens.dataclient;

import com.econlens.core.model.Observation;
import com.econlens.core.model.PeriodKey;
import com.econlens.core.store.SeriesFetcher;

import java.io.IOException;
import java.util.List;

/**
 * Loads series observations of one survey from the explorer backend.
 */
public class RemoteSeriesFetcher implements SeriesFetcher {

    private final ExplorerApiClient client;
    private final String source;
    private final String survey;

    public RemoteSeriesFetcher(ExplorerApiClient client, String source, String survey) {
        this.client = client;
        this.source = source;
        this.survey = survey;
    }

    @Override
    public List<Observation> fetch(String seriesId, PeriodKey rangeStart) throws IOException {
        return client.getSeriesData(source, survey, seriesId, rangeStart);
    }
}
