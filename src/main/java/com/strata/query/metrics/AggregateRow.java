package com.strata.query.metrics;

import java.util.List;

/**
 * One scanned row of the aggregate query: bucket index, sample factor,
 * bucket range bounds, one value per aggregator and one value per group.
 */
public class AggregateRow {
    private final long bucketId;
    private final double sampleFactor;
    private final double min;
    private final double max;
    private final List<Double> values;
    private final List<String> groups;

    public AggregateRow(long bucketId, double sampleFactor, double min, double max, List<Double> values,
                        List<String> groups) {
        this.bucketId = bucketId;
        this.sampleFactor = sampleFactor;
        this.min = min;
        this.max = max;
        this.values = values;
        this.groups = List.copyOf(groups);
    }

    public long getBucketId() {
        return bucketId;
    }

    public double getSampleFactor() {
        return sampleFactor;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /**
     * Aggregated values in expression order; an element is null when the
     * aggregate produced no value.
     */
    public List<Double> getValues() {
        return values;
    }

    public List<String> getGroups() {
        return groups;
    }
}
