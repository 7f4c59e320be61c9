package com.ecowatch.collectors.api;

import com.ecowatch.core.model.EnvironmentalSummary;

import java.util.Map;
import java.util.Optional;

/**
 * Latest summary per target location.
 */
public interface SummaryStore {
    Optional<EnvironmentalSummary> latest(String locationName);

    void put(EnvironmentalSummary summary);

    Map<String, EnvironmentalSummary> all();
}
