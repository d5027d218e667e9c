package com.factryl.backend.exception;

/**
 * Raised at startup when pipeline configuration is missing or inconsistent.
 * Never thrown while a batch is being processed.
 */
public class AggregationConfigException extends RuntimeException {

    public AggregationConfigException(String message) {
        super(message);
    }

    public AggregationConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
