package com.ecowatch.collectors.api;

import java.util.Objects;

/**
 * Outcome of one source call: either a value or the {@link SourceException} that replaced it.
 */
public record SourceResult<T>(T value, SourceException error) {
    public static <T> SourceResult<T> success(T value) {
        return new SourceResult<>(value, null);
    }

    public static <T> SourceResult<T> failure(SourceException error) {
        return new SourceResult<>(null, Objects.requireNonNull(error, "error is required"));
    }

    public boolean success() {
        return error == null;
    }
}
