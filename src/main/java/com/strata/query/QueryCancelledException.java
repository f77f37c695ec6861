package com.strata.query;

/**
 * Thrown when the request context was cancelled before or during a round trip
 */
public class QueryCancelledException extends QueryExecutionException {

    public QueryCancelledException(String table) {
        super("Query cancelled", table);
    }

    public QueryCancelledException(String table, String query, Throwable cause) {
        super("Query cancelled", table, query, cause);
    }
}
