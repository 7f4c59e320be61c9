package com.ecowatch.collectors.api;

/**
 * The upstream call succeeded but the payload lacks what the source needs.
 */
public class DataShapeException extends SourceException {
    public DataShapeException(String message) {
        super(message);
    }

    public DataShapeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorKind() {
        return "DataShapeError";
    }
}
