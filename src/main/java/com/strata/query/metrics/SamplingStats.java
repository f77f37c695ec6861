package com.strata.query.metrics;

/**
 * Estimated parts, rows and marks a query would read from one table
 */
public class SamplingStats {
    private final String database;
    private final String table;
    private final long parts;
    private final long rows;
    private final long marks;

    public SamplingStats(String database, String table, long parts, long rows, long marks) {
        this.database = database;
        this.table = table;
        this.parts = parts;
        this.rows = rows;
        this.marks = marks;
    }

    public String getDatabase() {
        return database;
    }

    public String getTable() {
        return table;
    }

    public long getParts() {
        return parts;
    }

    public long getRows() {
        return rows;
    }

    public long getMarks() {
        return marks;
    }

    @Override
    public String toString() {
        return "SamplingStats{" + table + ", rows=" + rows + ", parts=" + parts + ", marks=" + marks + "}";
    }
}
