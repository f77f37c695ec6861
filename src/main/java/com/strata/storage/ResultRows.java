package com.strata.storage;

import java.util.List;

/**
 * Untyped result set: column metadata plus one value list per row
 */
public class ResultRows {
    private final List<ResultColumn> columns;
    private final List<List<Object>> rows;

    public ResultRows(List<ResultColumn> columns, List<List<Object>> rows) {
        this.columns = List.copyOf(columns);
        this.rows = rows;
    }

    public List<ResultColumn> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
