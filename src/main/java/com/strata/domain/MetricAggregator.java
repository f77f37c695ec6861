package com.strata.domain;

/**
 * Aggregators supported by metric queries
 */
public enum MetricAggregator {
    COUNT,
    COUNT_DISTINCT,
    COUNT_DISTINCT_KEY,
    MIN,
    AVG,
    P50,
    P90,
    P95,
    P99,
    MAX,
    SUM;

    public boolean isDistinct() {
        return this == COUNT_DISTINCT || this == COUNT_DISTINCT_KEY;
    }
}
