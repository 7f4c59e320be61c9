package com.ecowatch.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * Operational alert about the pipeline itself, e.g. a collector run that blew up.
 */
public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    @Override
    public String type() {
        return "AlertRaised";
    }
}
