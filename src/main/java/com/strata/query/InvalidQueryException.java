package com.strata.query;

/**
 * Thrown when a request is malformed: a bad cursor, a disallowed SQL shape, a
 * missing aggregator expression and similar caller errors. Never retried.
 */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
