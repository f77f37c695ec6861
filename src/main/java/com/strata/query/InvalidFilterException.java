package com.strata.query;

/**
 * Thrown when a filter references a field the row cannot resolve
 */
public class InvalidFilterException extends InvalidQueryException {

    public InvalidFilterException(String message) {
        super(message);
    }

    public InvalidFilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
