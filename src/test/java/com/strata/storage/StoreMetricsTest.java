package com.strata.storage;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Test suite for StoreMetrics
 */
@DisplayName("StoreMetrics Tests")
class StoreMetricsTest {

    private MeterRegistry meterRegistry;
    private StoreMetrics storeMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        storeMetrics = new StoreMetrics(meterRegistry);
        storeMetrics.init();
    }

    @Test
    @DisplayName("Should record latency tagged by table, operation and outcome")
    void shouldRecordTaggedLatency() {
        Timer.Sample sample = storeMetrics.start();

        storeMetrics.record(sample, "logs", "SELECT", "success");

        Timer timer = meterRegistry.find(StoreMetrics.LATENCY)
            .tag("table", "logs")
            .tag("operation", "SELECT")
            .tag("outcome", "success")
            .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should tag unknown tables and count failures and cancellations")
    void shouldCountFailures() {
        storeMetrics.record(storeMetrics.start(), null, "INSERT", "failure");
        storeMetrics.recordFailure();
        storeMetrics.recordFailure();
        storeMetrics.recordCancelled();

        assertThat(meterRegistry.find(StoreMetrics.LATENCY).tag("table", "unknown").timer()).isNotNull();
        assertThat(storeMetrics.getQueriesFailed().count()).isEqualTo(2.0);
        assertThat(storeMetrics.getQueriesCancelled().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should never throw when a sample cannot be recorded")
    void shouldSwallowRecordingProblems() {
        assertThatCode(() -> storeMetrics.record(null, "logs", "SELECT", "success")).doesNotThrowAnyException();
    }
}
