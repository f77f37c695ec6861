package com.strata.domain;

/**
 * A single aggregator applied to a column
 */
public class MetricExpression {
    private final String column;
    private final MetricAggregator aggregator;

    public MetricExpression(String column, MetricAggregator aggregator) {
        this.column = column == null ? "" : column;
        this.aggregator = aggregator;
    }

    public String getColumn() {
        return column;
    }

    public MetricAggregator getAggregator() {
        return aggregator;
    }
}
