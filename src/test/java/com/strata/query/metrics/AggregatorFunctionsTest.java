package com.strata.query.metrics;

import com.strata.domain.MetricAggregator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for AggregatorFunctions
 */
@DisplayName("AggregatorFunctions Tests")
class AggregatorFunctionsTest {

    @Test
    @DisplayName("Should scale counts and sums by the sample factor only when sampling")
    void shouldScaleCountsAndSums() {
        assertThat(AggregatorFunctions.aggregate(MetricAggregator.COUNT, "x", true, false))
            .isEqualTo("round(count() * any(_sample_factor))");
        assertThat(AggregatorFunctions.aggregate(MetricAggregator.COUNT, "x", false, false))
            .isEqualTo("round(count() * 1.0)");
        assertThat(AggregatorFunctions.aggregate(MetricAggregator.SUM, "m", true, false))
            .isEqualTo("sum(m) * any(_sample_factor)");
        assertThat(AggregatorFunctions.aggregate(MetricAggregator.SUM, "m", false, false))
            .isEqualTo("sum(m) * 1.0");
        assertThat(AggregatorFunctions.aggregate(MetricAggregator.MAX, "m", true, false))
            .isEqualTo("toFloat64(max(m))");
    }

    @Test
    @DisplayName("Should produce quantiles and distinct counts")
    void shouldProduceQuantilesAndDistinctCounts() {
        assertThat(AggregatorFunctions.aggregate(MetricAggregator.P95, "m", false, false))
            .isEqualTo("quantile(.95)(m)");
        assertThat(AggregatorFunctions.aggregate(MetricAggregator.COUNT_DISTINCT, "u", false, false))
            .isEqualTo("round(count(distinct u) * 1.0)");
        assertThat(AggregatorFunctions.limit(MetricAggregator.P50, "m")).isEqualTo("quantile(.5)(m)");
        assertThat(AggregatorFunctions.limit(MetricAggregator.COUNT, "m")).isEqualTo("count()");
    }

    @Test
    @DisplayName("Should produce mergeable states and their history columns")
    void shouldProduceStates() {
        assertThat(AggregatorFunctions.aggregate(MetricAggregator.COUNT, "x", true, true)).isEqualTo("countState()");
        assertThat(AggregatorFunctions.aggregate(MetricAggregator.COUNT_DISTINCT_KEY, "k", false, true))
            .isEqualTo("uniqState(toString(k))");
        assertThat(AggregatorFunctions.aggregate(MetricAggregator.P99, "m", false, true))
            .isEqualTo("quantileState(.99)(toFloat64(m))");
        assertThat(AggregatorFunctions.stateColumn(MetricAggregator.COUNT_DISTINCT)).isEqualTo("UniqState");
        assertThat(AggregatorFunctions.stateColumn(MetricAggregator.P90)).isEqualTo("P90State");
    }
}
