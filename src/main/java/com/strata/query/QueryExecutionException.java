package com.strata.query;

/**
 * Exception thrown when a store round trip fails
 * Carries the table and statement that were being executed
 */
public class QueryExecutionException extends RuntimeException {

    private final String table;
    private final String query;

    public QueryExecutionException(String message, String table) {
        super(message);
        this.table = table;
        this.query = null;
    }

    public QueryExecutionException(String message, String table, Throwable cause) {
        super(message, cause);
        this.table = table;
        this.query = null;
    }

    public QueryExecutionException(String message, String table, String query, Throwable cause) {
        super(message, cause);
        this.table = table;
        this.query = query;
    }

    public String getTable() {
        return table;
    }

    public String getQuery() {
        return query;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (table != null) {
            sb.append(" [Table: ").append(table).append("]");
        }
        if (query != null) {
            sb.append(" [Query: ").append(query).append("]");
        }
        return sb.toString();
    }
}
