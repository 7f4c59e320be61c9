package com.ecowatch.collectors.api;

import java.util.OptionalInt;

/**
 * The upstream answered with a non-success status, or the transport failed before any status
 * was received.
 */
public class UpstreamException extends SourceException {
    private final Integer statusCode;

    public UpstreamException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public OptionalInt statusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }

    @Override
    public String errorKind() {
        return "UpstreamError";
    }
}
