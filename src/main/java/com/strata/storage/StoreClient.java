package com.strata.storage;

import com.strata.query.BuiltQuery;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;

/**
 * Executes compiled statements against the columnar store. Every call takes
 * the request's {@link StoreContext}, whose settings are attached to the
 * statement and whose cancellation aborts the round trip.
 */
public interface StoreClient {

    /**
     * Runs a query and maps each row.
     *
     * @param table table name used for instrumentation and error context
     */
    <T> List<T> query(StoreContext context, String table, BuiltQuery query, RowMapper<T> rowMapper);

    /**
     * Runs a query and returns the raw column metadata and untyped values.
     */
    ResultRows queryRows(StoreContext context, String table, BuiltQuery query);

    /**
     * Runs a statement that returns no rows.
     */
    void exec(StoreContext context, String table, BuiltQuery statement);
}
