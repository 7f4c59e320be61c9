package com.ecowatch.collectors.api;

public class SourceTimeoutException extends SourceException {
    public SourceTimeoutException(String message) {
        super(message);
    }

    public SourceTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorKind() {
        return "TimeoutError";
    }
}
