package com.strata.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Input to a metric bucket computation. Either {@code sql} is set and the
 * statement is rewritten and executed as is, or the bucketing fields describe
 * a structured aggregation.
 */
public class MetricsRequest {
    /** Sentinel limit meaning "no top-N limiting". */
    public static final int NO_LIMIT = Integer.MAX_VALUE;

    private SampleableTableConfig sampleableConfig;
    private List<Integer> projectIds = new ArrayList<>();
    private String sql;
    private QueryInput params = new QueryInput();
    private List<String> groupBy = new ArrayList<>();
    private Integer bucketCount;
    private Integer bucketWindow;
    private String bucketBy = MetricBucketBy.NONE.getValue();
    private Integer limit;
    private MetricAggregator limitAggregator;
    private String limitColumn;
    private SavedMetricState savedMetricState;
    private boolean noBucketMax;
    private List<MetricExpression> expressions = new ArrayList<>();

    public SampleableTableConfig getSampleableConfig() {
        return sampleableConfig;
    }

    public void setSampleableConfig(SampleableTableConfig sampleableConfig) {
        this.sampleableConfig = sampleableConfig;
    }

    public List<Integer> getProjectIds() {
        return projectIds;
    }

    public void setProjectIds(List<Integer> projectIds) {
        this.projectIds = projectIds != null ? projectIds : new ArrayList<>();
    }

    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }

    public QueryInput getParams() {
        return params;
    }

    public void setParams(QueryInput params) {
        this.params = params != null ? params : new QueryInput();
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public void setGroupBy(List<String> groupBy) {
        this.groupBy = groupBy != null ? groupBy : new ArrayList<>();
    }

    public Integer getBucketCount() {
        return bucketCount;
    }

    public void setBucketCount(Integer bucketCount) {
        this.bucketCount = bucketCount;
    }

    /**
     * Fixed bucket width in seconds; takes precedence over the bucket count.
     */
    public Integer getBucketWindow() {
        return bucketWindow;
    }

    public void setBucketWindow(Integer bucketWindow) {
        this.bucketWindow = bucketWindow;
    }

    public String getBucketBy() {
        return bucketBy;
    }

    public void setBucketBy(String bucketBy) {
        this.bucketBy = bucketBy;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public MetricAggregator getLimitAggregator() {
        return limitAggregator;
    }

    public void setLimitAggregator(MetricAggregator limitAggregator) {
        this.limitAggregator = limitAggregator;
    }

    public String getLimitColumn() {
        return limitColumn;
    }

    public void setLimitColumn(String limitColumn) {
        this.limitColumn = limitColumn;
    }

    public SavedMetricState getSavedMetricState() {
        return savedMetricState;
    }

    public void setSavedMetricState(SavedMetricState savedMetricState) {
        this.savedMetricState = savedMetricState;
    }

    public boolean isNoBucketMax() {
        return noBucketMax;
    }

    public void setNoBucketMax(boolean noBucketMax) {
        this.noBucketMax = noBucketMax;
    }

    public List<MetricExpression> getExpressions() {
        return expressions;
    }

    public void setExpressions(List<MetricExpression> expressions) {
        this.expressions = expressions != null ? expressions : new ArrayList<>();
    }
}
