package com.strata.storage;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for store round trips
 * Records one timer sample per statement, tagged with the table and the
 * operation, and counts failures and cancellations
 */
@Component
public class StoreMetrics {
    private static final Logger log = LoggerFactory.getLogger(StoreMetrics.class);

    static final String LATENCY = "strata.store.query.latency";

    private final MeterRegistry meterRegistry;

    private Counter queriesFailed;
    private Counter queriesCancelled;

    public StoreMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        queriesFailed = Counter.builder("strata.store.query.failed")
            .description("Total number of store round trips that failed")
            .register(meterRegistry);

        queriesCancelled = Counter.builder("strata.store.query.cancelled")
            .description("Total number of store round trips aborted by cancellation")
            .register(meterRegistry);
    }

    public Timer.Sample start() {
        return Timer.start(meterRegistry);
    }

    /**
     * Stops the sample. Instrumentation problems are logged, never thrown.
     */
    public void record(Timer.Sample sample, String table, String operation, String outcome) {
        try {
            Timer timer = Timer.builder(LATENCY)
                .description("Latency of store round trips")
                .tag("table", table == null ? "unknown" : table)
                .tag("operation", operation)
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.95, 0.99)
                .minimumExpectedValue(Duration.ofMillis(1))
                .maximumExpectedValue(Duration.ofSeconds(60))
                .register(meterRegistry);
            sample.stop(timer);
        } catch (RuntimeException e) {
            log.warn("Failed to record store latency for {} {}", operation, table, e);
        }
    }

    public void recordFailure() {
        queriesFailed.increment();
    }

    public void recordCancelled() {
        queriesCancelled.increment();
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Counter getQueriesCancelled() {
        return queriesCancelled;
    }
}
