package com.ecowatch.service.store;

import com.ecowatch.collectors.api.SummaryStore;
import com.ecowatch.core.model.EnvironmentalSummary;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps only the latest summary per location, matched case-insensitively. Nothing is persisted.
 */
public final class InMemorySummaryStore implements SummaryStore {
    private final Map<String, EnvironmentalSummary> summaries = new ConcurrentHashMap<>();

    @Override
    public Optional<EnvironmentalSummary> latest(String locationName) {
        if (locationName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(summaries.get(key(locationName)));
    }

    @Override
    public void put(EnvironmentalSummary summary) {
        summaries.put(key(summary.targetLocationName()), summary);
    }

    @Override
    public Map<String, EnvironmentalSummary> all() {
        Map<String, EnvironmentalSummary> byName = new LinkedHashMap<>();
        summaries.values().forEach(summary -> byName.put(summary.targetLocationName(), summary));
        return Map.copyOf(byName);
    }

    private static String key(String locationName) {
        return locationName.trim().toLowerCase(Locale.ROOT);
    }
}
