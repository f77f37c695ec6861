package com.strata.query;

/**
 * Exception thrown when user supplied SQL cannot be parsed
 */
public class QueryParseException extends RuntimeException {

    private final String sql;

    public QueryParseException(String message, String sql, Throwable cause) {
        super(message, cause);
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }
}
