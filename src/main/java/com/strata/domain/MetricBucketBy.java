package com.strata.domain;

/**
 * Reserved bucket-by dimensions. Any other value names a field to bucket on.
 */
public enum MetricBucketBy {
    NONE("None"),
    TIMESTAMP("Timestamp");

    private final String value;

    MetricBucketBy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean matches(String bucketBy) {
        return value.equals(bucketBy);
    }
}
