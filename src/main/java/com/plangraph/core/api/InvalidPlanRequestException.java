package com.plangraph.core.api;

/**
 * Thrown when the options of a plan operation are malformed. Raised before
 * the graph is read.
 */
public class InvalidPlanRequestException extends RuntimeException {
    public InvalidPlanRequestException(String message) {
        super(message);
    }

    public InvalidPlanRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
