package com.strata.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One aggregated value for a bucket and group tuple. A null metric value
 * means no rows fell into the bucket.
 */
public class MetricBucket {

    @JsonProperty("bucket_id")
    private long bucketId;

    @JsonProperty("bucket_value")
    private Double bucketValue;

    @JsonProperty("bucket_min")
    private Double bucketMin;

    @JsonProperty("bucket_max")
    private Double bucketMax;

    @JsonProperty("group")
    private List<String> group;

    @JsonProperty("metric_type")
    private String metricType;

    @JsonProperty("column")
    private String column;

    @JsonProperty("metric_value")
    private Double metricValue;

    public MetricBucket() {
        this.group = List.of();
    }

    public long getBucketId() {
        return bucketId;
    }

    public void setBucketId(long bucketId) {
        this.bucketId = bucketId;
    }

    public Double getBucketValue() {
        return bucketValue;
    }

    public void setBucketValue(Double bucketValue) {
        this.bucketValue = bucketValue;
    }

    public Double getBucketMin() {
        return bucketMin;
    }

    public void setBucketMin(Double bucketMin) {
        this.bucketMin = bucketMin;
    }

    public Double getBucketMax() {
        return bucketMax;
    }

    public void setBucketMax(Double bucketMax) {
        this.bucketMax = bucketMax;
    }

    public List<String> getGroup() {
        return group;
    }

    public void setGroup(List<String> group) {
        this.group = group == null ? List.of() : List.copyOf(group);
    }

    public String getMetricType() {
        return metricType;
    }

    public void setMetricType(String metricType) {
        this.metricType = metricType;
    }

    public String getColumn() {
        return column;
    }

    public void setColumn(String column) {
        this.column = column;
    }

    public Double getMetricValue() {
        return metricValue;
    }

    public void setMetricValue(Double metricValue) {
        this.metricValue = metricValue;
    }

    @Override
    public String toString() {
        return "MetricBucket{id=" + bucketId + ", group=" + group + ", type=" + metricType
                + ", range=[" + bucketMin + ", " + bucketMax + "), value=" + metricValue + "}";
    }
}
