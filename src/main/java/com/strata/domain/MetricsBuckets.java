package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a metric query: the contiguous buckets plus the overall sample
 * factor and bucket count.
 */
public class MetricsBuckets {

    @JsonProperty("buckets")
    private List<MetricBucket> buckets;

    @JsonProperty("sample_factor")
    private double sampleFactor;

    @JsonProperty("bucket_count")
    private long bucketCount;

    public MetricsBuckets() {
        this.buckets = new ArrayList<>();
    }

    public List<MetricBucket> getBuckets() {
        return buckets;
    }

    public void setBuckets(List<MetricBucket> buckets) {
        this.buckets = buckets != null ? buckets : new ArrayList<>();
    }

    public double getSampleFactor() {
        return sampleFactor;
    }

    public void setSampleFactor(double sampleFactor) {
        this.sampleFactor = sampleFactor;
    }

    public long getBucketCount() {
        return bucketCount;
    }

    public void setBucketCount(long bucketCount) {
        this.bucketCount = bucketCount;
    }
}
