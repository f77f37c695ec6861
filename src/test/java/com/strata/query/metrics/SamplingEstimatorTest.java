package com.strata.query.metrics;

import com.strata.domain.DateRange;
import com.strata.domain.SampleableTableConfig;
import com.strata.query.BuiltQuery;
import com.strata.storage.DefaultTableConfigRegistry;
import com.strata.storage.StoreClient;
import com.strata.storage.StoreContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SamplingEstimator
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SamplingEstimator Tests")
class SamplingEstimatorTest {

    private static final DateRange RANGE = new DateRange(
        Instant.ofEpochSecond(1700000000L), Instant.ofEpochSecond(1700086400L));

    @Mock
    private StoreClient storeClient;

    private final DefaultTableConfigRegistry registry = new DefaultTableConfigRegistry();
    private final StoreContext context = StoreContext.create();
    private SamplingEstimator estimator;

    @BeforeEach
    void setUp() {
        estimator = new SamplingEstimator(storeClient);
    }

    private void givenRows(long primaryRows, long samplingRows) {
        when(storeClient.query(any(), anyString(), any(), any())).thenReturn(List.of(
            new SamplingStats("default", "logs", 12, primaryRows, 100),
            new SamplingStats("default", "logs_sampling", 12, samplingRows, 100)));
    }

    @Test
    @DisplayName("Should read the primary table when sampling is disabled")
    void shouldSkipEstimateWithoutSamplingTable() {
        SampleableTableConfig sessions = registry.sampleable(DefaultTableConfigRegistry.SESSIONS, 1000);

        TableChoice choice = estimator.choose(context, sessions, List.of(1), RANGE);

        assertThat(choice.isSampled()).isFalse();
        verifyNoInteractions(storeClient);
    }

    @Test
    @DisplayName("Should read the primary table when it fits the row budget")
    void shouldKeepPrimaryUnderBudget() {
        // Given: Five million rows against a twenty million budget
        givenRows(5_000_000L, 500_000L);

        // When: Choosing the table
        TableChoice choice = estimator.choose(context,
            registry.sampleable(DefaultTableConfigRegistry.LOGS, 20_000_000L), List.of(1), RANGE);

        // Then: No sampling applies
        assertThat(choice.isSampled()).isFalse();
    }

    @Test
    @DisplayName("Should read the primary table when the sampling table is empty")
    void shouldKeepPrimaryWithEmptySamplingTable() {
        givenRows(100_000_000L, 0L);

        TableChoice choice = estimator.choose(context,
            registry.sampleable(DefaultTableConfigRegistry.LOGS, 20_000_000L), List.of(1), RANGE);

        assertThat(choice.isSampled()).isFalse();
    }

    @Test
    @DisplayName("Should sample at the ratio targeting the row budget")
    void shouldSampleLargeTables() {
        // Given: The sampling table holds twice the budget
        givenRows(100_000_000L, 40_000_000L);

        // When: Choosing the table
        TableChoice choice = estimator.choose(context,
            registry.sampleable(DefaultTableConfigRegistry.LOGS, 20_000_000L), List.of(1), RANGE);

        // Then: Half of the sampling table is read
        assertThat(choice.isSampled()).isTrue();
        assertThat(choice.getRatio()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should estimate every table in one EXPLAIN ESTIMATE statement")
    void shouldBuildEstimateQuery() {
        // Given: Stats for both tables
        givenRows(10L, 1L);
        SampleableTableConfig logs = registry.sampleable(DefaultTableConfigRegistry.LOGS, 1000);

        // When: Estimating with a duplicate project id
        Map<String, SamplingStats> stats = estimator.estimate(context,
            List.of(logs.getTableConfig(), logs.getSamplingTableConfig()), List.of(1, 1), RANGE);

        // Then: One union is sent and results are keyed by table
        ArgumentCaptor<BuiltQuery> captor = ArgumentCaptor.forClass(BuiltQuery.class);
        verify(storeClient).query(eq(context), eq("logs,logs_sampling"), captor.capture(), any());
        assertThat(captor.getValue().getSql()).isEqualTo("EXPLAIN ESTIMATE "
            + "(SELECT 1 FROM logs WHERE ProjectId IN (?) AND Timestamp >= ? AND Timestamp <= ?)"
            + " UNION ALL "
            + "(SELECT 1 FROM logs_sampling WHERE ProjectId IN (?) AND Timestamp >= ? AND Timestamp <= ?)");
        assertThat(captor.getValue().getArgs()).containsExactly(
            1, RANGE.getStartDate(), RANGE.getEndDate(), 1, RANGE.getStartDate(), RANGE.getEndDate());
        assertThat(stats).containsOnlyKeys("logs", "logs_sampling");
        assertThat(stats.get("logs").getRows()).isEqualTo(10L);
    }
}
