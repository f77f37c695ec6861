package com.strata.query.metrics;

import com.strata.domain.DateRange;
import com.strata.domain.MetricsRequest;
import com.strata.domain.TableConfig;
import com.strata.query.InvalidQueryException;
import com.strata.query.QueryLimits;
import com.strata.query.SelectBuilder;
import com.strata.storage.DefaultTableConfigRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for Bucketing
 */
@DisplayName("Bucketing Tests")
class BucketingTest {

    private static final Instant START = Instant.ofEpochSecond(1_700_000_000L);
    private static final Instant END = START.plus(Duration.ofHours(4));

    private DefaultTableConfigRegistry registry;
    private TableConfig logs;
    private QueryLimits limits;
    private DateRange range;

    @BeforeEach
    void setUp() {
        registry = new DefaultTableConfigRegistry();
        logs = registry.get(DefaultTableConfigRegistry.LOGS);
        limits = QueryLimits.defaults();
        range = new DateRange(START, END);
    }

    @Test
    @DisplayName("Should use the default count for timestamp bucketing and one bucket for none")
    void shouldPickDefaultCounts() {
        assertThat(compute(request("Timestamp", null, null)).getBucketCount()).isEqualTo(48);
        assertThat(compute(request("None", 20, null)).getBucketCount()).isEqualTo(1);
        assertThat(compute(request(null, null, null)).getBucketCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should cap explicit counts at the maximum unless uncapped")
    void shouldCapBucketCount() {
        MetricsRequest request = request("Timestamp", 1000, null);
        assertThat(compute(request).getBucketCount()).isEqualTo(240);

        request.setNoBucketMax(true);
        assertThat(compute(request).getBucketCount()).isEqualTo(1000);

        assertThat(compute(request("Timestamp", 0, null)).getBucketCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should derive the count from a window and move the start when capped")
    void shouldDeriveCountFromWindow() {
        BucketingInfo hourly = compute(request("Timestamp", null, 3600));
        assertThat(hourly.getBucketCount()).isEqualTo(4);
        assertThat(hourly.getStartDate()).isEqualTo(START);

        range = new DateRange(END.minus(Duration.ofDays(30)), END);
        BucketingInfo minutely = compute(request("Timestamp", null, 60));
        assertThat(minutely.getBucketCount()).isEqualTo(240);
        assertThat(minutely.getStartDate()).isEqualTo(END.minusSeconds(240 * 60));
    }

    @Test
    @DisplayName("Should reject a zero or negative bucket window")
    void shouldRejectNonPositiveWindow() {
        assertThatThrownBy(() -> compute(request("Timestamp", null, 0)))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessage("Bucket window must be positive, found 0");
        assertThatThrownBy(() -> compute(request("Timestamp", null, -60)))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessage("Bucket window must be positive, found -60");
    }

    @Test
    @DisplayName("Should index timestamp buckets against the static range bounds")
    void shouldIndexByTimestamp() {
        BucketingInfo info = compute(request("Timestamp", 4, null));

        assertThat(info.getSelectItems()).containsExactly(
            "toUInt64(intDiv((toFloat64(Timestamp) - 1700000000.0) * 4, (1700014400.0 - 1700000000.0)))"
                + " AS __strata_bucket_index",
            "1700000000.0 AS __strata_min",
            "1700014400.0 AS __strata_max");
        assertThat(info.getAttributeFields()).isEmpty();
    }

    @Test
    @DisplayName("Should bound column buckets with window aggregates")
    void shouldIndexByColumn() {
        TableConfig traces = registry.get(DefaultTableConfigRegistry.TRACES);

        BucketingInfo info = Bucketing.compute(traces, request("duration", 10, null), range, new SelectBuilder(),
            limits);

        assertThat(info.getSelectItems()).containsExactly(
            "toUInt64(intDiv((toFloat64(Duration) - MIN(toFloat64(Duration)) OVER ()) * 10, "
                + "(MAX(toFloat64(Duration)) OVER () - MIN(toFloat64(Duration)) OVER ())))"
                + " AS __strata_bucket_index",
            "MIN(toFloat64(Duration)) OVER () AS __strata_min",
            "MAX(toFloat64(Duration)) OVER () AS __strata_max");
    }

    @Test
    @DisplayName("Should bucket attributes numerically and report the attribute field")
    void shouldIndexByAttribute() {
        SelectBuilder sb = new SelectBuilder();

        BucketingInfo info = Bucketing.compute(logs, request("latency_ms", 10, null), range, sb, limits);

        assertThat(info.getSelectItems().get(1))
            .isEqualTo("MIN(toFloat64OrNull(LogAttributes[${0}])) OVER () AS __strata_min");
        assertThat(info.getAttributeFields()).containsExactly("latency_ms");
        assertThat(sb.build().getArgs()).containsExactly("latency_ms");
    }

    private BucketingInfo compute(MetricsRequest request) {
        return Bucketing.compute(logs, request, range, new SelectBuilder(), limits);
    }

    private static MetricsRequest request(String bucketBy, Integer bucketCount, Integer bucketWindow) {
        MetricsRequest request = new MetricsRequest();
        request.setBucketBy(bucketBy);
        request.setBucketCount(bucketCount);
        request.setBucketWindow(bucketWindow);
        return request;
    }
}
