package com.ecowatch.core.events;

import java.time.Instant;

public record SummaryCollected(
        Instant timestamp,
        String location,
        int sourceErrorCount,
        int seismicEventCount,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "SummaryCollected";
    }
}
