package com.ecowatch.core.events;

import java.time.Instant;

public record SourceFailed(
        Instant timestamp,
        String location,
        String source,
        String errorKind,
        String message
) implements Event {
    @Override
    public String type() {
        return "SourceFailed";
    }
}
