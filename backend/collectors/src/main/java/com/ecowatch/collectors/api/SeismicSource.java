package com.ecowatch.collectors.api;

import com.ecowatch.core.model.SeismicEvent;

import java.time.Instant;
import java.util.List;

@FunctionalInterface
public interface SeismicSource {
    /**
     * Region-matching events no older than the recency window before {@code referenceTime},
     * most recent first.
     */
    List<SeismicEvent> fetchSeismicEvents(Instant referenceTime);
}
