package com.strata.query.decode;

import com.strata.domain.MetricBucket;
import com.strata.domain.MetricsBuckets;
import com.strata.storage.ResultColumn;
import com.strata.storage.ResultRows;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for RowDecoder
 */
@DisplayName("RowDecoder Tests")
class RowDecoderTest {

    @Test
    @DisplayName("Should turn each value column of a row into one bucket")
    void shouldDecodeValueColumns() {
        // Given: A row with a time bucket, a string group and two value columns
        List<ResultColumn> columns = List.of(
            new ResultColumn("ts", "DateTime"),
            new ResultColumn("service", "String"),
            new ResultColumn("count_series", "UInt64"),
            new ResultColumn("p50", "Nullable(Float64)"));
        List<Object> row = Arrays.asList(Instant.ofEpochSecond(1_700_000_000L), "api", 5L, null);

        // When: Decoding the row
        List<MetricBucket> buckets = RowDecoder.decodeRow(columns, row);

        // Then: Two buckets share the bucket id and group
        assertThat(buckets).hasSize(2);
        assertThat(buckets).allSatisfy(bucket -> {
            assertThat(bucket.getBucketId()).isEqualTo(1_700_000_000L);
            assertThat(bucket.getBucketValue()).isEqualTo(1.7e9);
            assertThat(bucket.getGroup()).containsExactly("api");
        });
        assertThat(buckets.get(0).getMetricType()).isEqualTo("count");
        assertThat(buckets.get(0).getMetricValue()).isEqualTo(5.0);
        assertThat(buckets.get(1).getMetricType()).isEqualTo("p50");
        assertThat(buckets.get(1).getMetricValue()).isNull();
    }

    @Test
    @DisplayName("Should treat suffixed columns as groups whatever their type")
    void shouldDecodeGroupSuffix() {
        List<ResultColumn> columns = List.of(
            new ResultColumn("status_group", "UInt16"),
            new ResultColumn("day_group", "DateTime"),
            new ResultColumn("region_group", "Nullable(String)"),
            new ResultColumn("errors", "Bool"),
            new ResultColumn("value", "Float64"));
        List<Object> row = Arrays.asList(200, LocalDateTime.of(2024, 1, 2, 3, 4, 5), null, true, 1.5);

        List<MetricBucket> buckets = RowDecoder.decodeRow(columns, row);

        assertThat(buckets).hasSize(1);
        assertThat(buckets.get(0).getGroup()).containsExactly("200", "2024-01-02T03:04:05Z", "", "true");
        assertThat(buckets.get(0).getBucketId()).isZero();
        assertThat(buckets.get(0).getBucketValue()).isNull();
        assertThat(buckets.get(0).getMetricValue()).isEqualTo(1.5);
    }

    @Test
    @DisplayName("Should parse numeric text in series columns and skip the rest")
    void shouldParseSeriesText() {
        List<ResultColumn> columns = List.of(
            new ResultColumn("a_series", "String"),
            new ResultColumn("b_series", "String"),
            new ResultColumn("flag_series", "Bool"));
        List<Object> row = Arrays.asList("2.5", "n/a", false);

        List<MetricBucket> buckets = RowDecoder.decodeRow(columns, row);

        assertThat(buckets).extracting(MetricBucket::getMetricType).containsExactly("a", "flag");
        assertThat(buckets).extracting(MetricBucket::getMetricValue).containsExactly(2.5, 0.0);
    }

    @Test
    @DisplayName("Should decode every row of a result set in order")
    void shouldDecodeAllRows() {
        ResultRows rows = new ResultRows(
            List.of(new ResultColumn("ts", "DateTime"), new ResultColumn("total", "UInt64")),
            List.of(
                Arrays.asList(Instant.ofEpochSecond(60), 1L),
                Arrays.asList(Instant.ofEpochSecond(120), 2L)));

        MetricsBuckets metrics = RowDecoder.decode(rows);

        assertThat(metrics.getBuckets()).extracting(MetricBucket::getBucketId).containsExactly(60L, 120L);
        assertThat(metrics.getBuckets()).extracting(MetricBucket::getMetricValue).containsExactly(1.0, 2.0);
    }
}
