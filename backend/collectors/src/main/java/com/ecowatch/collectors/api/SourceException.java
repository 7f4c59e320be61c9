package com.ecowatch.collectors.api;

/**
 * Failure of a single upstream source. Subclasses narrow down why; a plain instance wraps an
 * unexpected runtime failure inside a source.
 */
public class SourceException extends RuntimeException {
    public SourceException(String message) {
        super(message);
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }

    public String errorKind() {
        return "SourceError";
    }
}
