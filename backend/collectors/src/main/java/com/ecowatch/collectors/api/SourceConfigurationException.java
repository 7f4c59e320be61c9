package com.ecowatch.collectors.api;

/**
 * A source cannot run because the operator has not configured it, typically a missing API key.
 * Retrying does not help.
 */
public class SourceConfigurationException extends SourceException {
    public SourceConfigurationException(String message) {
        super("Configuration error: " + message);
    }

    @Override
    public String errorKind() {
        return "ConfigurationError";
    }
}
