package com.strata.query.metrics;

import com.strata.domain.MetricAggregator;
import com.strata.domain.MetricBucket;
import com.strata.domain.MetricExpression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for BucketAssembler
 */
@DisplayName("BucketAssembler Tests")
class BucketAssemblerTest {

    private static final List<MetricExpression> COUNT = List.of(new MetricExpression("", MetricAggregator.COUNT));

    @Test
    @DisplayName("Should fill gaps and the tail of a series with null buckets")
    void shouldFillGaps() {
        // Given: Rows for buckets 0 and 2 of 4
        List<AggregateRow> rows = List.of(
            row(0, List.of("api"), 5.0),
            row(2, List.of("api"), 7.0));

        // When: Assembling
        List<MetricBucket> buckets = BucketAssembler.assemble(rows, COUNT, 1, 4, null, null);

        // Then: Every bucket id is present once
        assertThat(buckets).extracting(MetricBucket::getBucketId, MetricBucket::getMetricValue)
            .containsExactly(tuple(0L, 5.0), tuple(1L, null), tuple(2L, 7.0), tuple(3L, null));
        assertThat(buckets).allSatisfy(bucket -> {
            assertThat(bucket.getGroup()).containsExactly("api");
            assertThat(bucket.getMetricType()).isEqualTo("COUNT");
        });
    }

    @Test
    @DisplayName("Should compute bucket bounds from the series range")
    void shouldComputeBounds() {
        List<MetricBucket> buckets = BucketAssembler.assemble(List.of(row(1, List.of("a"), 1.0)), COUNT, 1, 4,
            null, null);

        assertThat(buckets).extracting(MetricBucket::getBucketMin).containsExactly(0.0, 100.0, 200.0, 300.0);
        assertThat(buckets).extracting(MetricBucket::getBucketMax).containsExactly(100.0, 200.0, 300.0, 400.0);
    }

    @Test
    @DisplayName("Should interleave groups by bucket id then first appearance")
    void shouldOrderGroups() {
        List<AggregateRow> rows = List.of(
            row(0, List.of("b"), 1.0),
            row(0, List.of("a"), 2.0),
            row(1, List.of("a"), 3.0));

        List<MetricBucket> buckets = BucketAssembler.assemble(rows, COUNT, 1, 2, null, null);

        assertThat(buckets).extracting(b -> b.getBucketId() + ":" + b.getGroup().get(0) + ":" + b.getMetricValue())
            .containsExactly("0:b:1.0", "0:a:2.0", "1:b:null", "1:a:3.0");
    }

    @Test
    @DisplayName("Should emit one value per expression per bucket")
    void shouldEmitEveryExpression() {
        List<MetricExpression> expressions = List.of(
            new MetricExpression("Duration", MetricAggregator.P50),
            new MetricExpression("Duration", MetricAggregator.MAX));

        List<MetricBucket> buckets = BucketAssembler.assemble(
            List.of(row(0, List.of(), 10.0, 20.0)), expressions, 0, 1, null, null);

        assertThat(buckets).extracting(MetricBucket::getMetricType, MetricBucket::getColumn,
                MetricBucket::getMetricValue)
            .containsExactly(tuple("P50", "Duration", 10.0), tuple("MAX", "Duration", 20.0));
    }

    @Test
    @DisplayName("Should return one empty series over the fallback range when no rows came back")
    void shouldFillEmptyResult() {
        List<MetricBucket> buckets = BucketAssembler.assemble(List.of(), COUNT, 2, 4, 0.0, 14400.0);

        assertThat(buckets).hasSize(4);
        assertThat(buckets).extracting(MetricBucket::getBucketMin).containsExactly(0.0, 3600.0, 7200.0, 10800.0);
        assertThat(buckets).allSatisfy(bucket -> {
            assertThat(bucket.getMetricValue()).isNull();
            assertThat(bucket.getGroup()).containsExactly("", "");
        });
    }

    @Test
    @DisplayName("Should drop rows beyond the bucket count")
    void shouldDropStaleRows() {
        List<MetricBucket> buckets = BucketAssembler.assemble(
            List.of(row(0, List.of("a"), 1.0), row(5, List.of("a"), 9.0)), COUNT, 1, 2, null, null);

        assertThat(buckets).extracting(MetricBucket::getMetricValue).containsExactly(1.0, null);
    }

    private static AggregateRow row(long bucketId, List<String> groups, Double... values) {
        return new AggregateRow(bucketId, 1.0, 0.0, 400.0, Arrays.asList(values), groups);
    }
}
