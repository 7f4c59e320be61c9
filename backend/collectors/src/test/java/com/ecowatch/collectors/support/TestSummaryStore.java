package com.ecowatch.collectors.support;

import com.ecowatch.collectors.api.SummaryStore;
import com.ecowatch.core.model.EnvironmentalSummary;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class TestSummaryStore implements SummaryStore {
    private final Map<String, EnvironmentalSummary> summaries = new ConcurrentHashMap<>();

    @Override
    public Optional<EnvironmentalSummary> latest(String locationName) {
        return Optional.ofNullable(summaries.get(locationName));
    }

    @Override
    public void put(EnvironmentalSummary summary) {
        summaries.put(summary.targetLocationName(), summary);
    }

    @Override
    public Map<String, EnvironmentalSummary> all() {
        return Map.copyOf(summaries);
    }
}
