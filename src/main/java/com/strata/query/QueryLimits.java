package com.strata.query;

/**
 * Engine limits, passed explicitly into each entry point
 */
public class QueryLimits {
    private final int maxBuckets;
    private final int defaultBuckets;
    private final int maxResultRows;
    private final long samplingRows;
    private final long keysMaxRows;
    private final long keyValuesMaxRows;
    private final long allKeyValuesMaxRows;
    private final int defaultPageSize;
    private final int logLinesLimit;

    public QueryLimits(int maxBuckets, int defaultBuckets, int maxResultRows, long samplingRows,
                       long keysMaxRows, long keyValuesMaxRows, long allKeyValuesMaxRows,
                       int defaultPageSize, int logLinesLimit) {
        this.maxBuckets = maxBuckets;
        this.defaultBuckets = defaultBuckets;
        this.maxResultRows = maxResultRows;
        this.samplingRows = samplingRows;
        this.keysMaxRows = keysMaxRows;
        this.keyValuesMaxRows = keyValuesMaxRows;
        this.allKeyValuesMaxRows = allKeyValuesMaxRows;
        this.defaultPageSize = defaultPageSize;
        this.logLinesLimit = logLinesLimit;
    }

    public static QueryLimits defaults() {
        return new QueryLimits(240, 48, 10_000, 20_000_000L, 1_000_000L, 1_000_000L, 100_000_000L, 50, 1000);
    }

    public int getMaxBuckets() {
        return maxBuckets;
    }

    public int getDefaultBuckets() {
        return defaultBuckets;
    }

    public int getMaxResultRows() {
        return maxResultRows;
    }

    /**
     * Target row budget for sampled metric queries.
     */
    public long getSamplingRows() {
        return samplingRows;
    }

    public long getKeysMaxRows() {
        return keysMaxRows;
    }

    public long getKeyValuesMaxRows() {
        return keyValuesMaxRows;
    }

    public long getAllKeyValuesMaxRows() {
        return allKeyValuesMaxRows;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public int getLogLinesLimit() {
        return logLinesLimit;
    }
}
