package com.strata.query.metrics;

import com.strata.domain.BlockNumberInfo;
import com.strata.domain.MetricAggregator;
import com.strata.domain.MetricExpression;
import com.strata.domain.MetricsRequest;
import com.strata.domain.SavedMetricState;
import com.strata.query.BuiltQuery;
import com.strata.query.SelectBuilder;
import com.strata.storage.StoreClient;
import com.strata.storage.StoreContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for MetricHistoryWriter
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("MetricHistoryWriter Tests")
class MetricHistoryWriterTest {

    @Mock
    private StoreClient storeClient;

    private MetricHistoryWriter writer;

    @BeforeEach
    void setUp() {
        writer = new MetricHistoryWriter(storeClient);
    }

    private static MetricsRequest request(List<String> groupBy) {
        MetricsRequest request = new MetricsRequest();
        request.setSavedMetricState(new SavedMetricState("m-1", List.of()));
        request.setExpressions(List.of(new MetricExpression("duration", MetricAggregator.SUM)));
        request.setGroupBy(groupBy);
        return request;
    }

    @Test
    @DisplayName("Should restrict reads to parts past the saved block numbers")
    void shouldApplyBlockFilter() {
        // Given: One saved partition high-water mark
        SelectBuilder sb = new SelectBuilder().from("logs");
        SavedMetricState state = new SavedMetricState("m-1", List.of(new BlockNumberInfo("2024-01-01", 100L)));

        // When: Applying the filter
        MetricHistoryWriter.applyBlockFilter(sb, "logs", state);
        BuiltQuery built = sb.build();

        // Then: Both the part list and the block numbers are filtered
        assertThat(built.getSql()).isEqualTo("SELECT * FROM logs WHERE _part IN "
            + "(SELECT name FROM system.parts WHERE table = ? AND active"
            + " AND ((partition = ? AND max_block_number > ?)))"
            + " AND ((_partition_id = ? AND _block_number > ?))");
        assertThat(built.getArgs()).containsExactly("logs", "2024-01-01", 100L, "20240101", 100L);
    }

    @Test
    @DisplayName("Should leave the query untouched without saved block numbers")
    void shouldSkipBlockFilterWithoutState() {
        SelectBuilder sb = new SelectBuilder().from("logs");

        MetricHistoryWriter.applyBlockFilter(sb, "logs", null);
        MetricHistoryWriter.applyBlockFilter(sb, "logs", new SavedMetricState("m-1", null));

        assertThat(sb.build().getSql()).isEqualTo("SELECT * FROM logs");
    }

    @Test
    @DisplayName("Should insert aggregate states with the metric id first")
    void shouldBuildInsert() {
        SelectBuilder state = new SelectBuilder();
        state.select("x").from("logs").where(state.equal("ProjectId", 1));

        BuiltQuery insert = writer.buildInsert(state, request(List.of("service_name")), 48);

        assertThat(insert.getSql()).isEqualTo("INSERT INTO metric_history "
            + "(MetricId, Timestamp, MaxBlockNumberState, "
            + AggregatorFunctions.stateColumn(MetricAggregator.SUM) + ", GroupByKey) "
            + "SELECT ?, fromUnixTimestamp(toInt64("
            + "__strata_bucket_index*(__strata_max-__strata_min)/48 + __strata_min)), "
            + "max_block_number, metric_value0, g0 "
            + "FROM (SELECT x FROM logs WHERE ProjectId = ?) AS innerSelect");
        assertThat(insert.getArgs()).containsExactly("m-1", 1);
    }

    @Test
    @DisplayName("Should execute the insert against the history table")
    void shouldSaveThroughExec() {
        StoreContext context = StoreContext.create();
        SelectBuilder state = new SelectBuilder().select("x").from("logs");

        writer.save(context, state, request(List.of()), 4);

        ArgumentCaptor<BuiltQuery> captor = ArgumentCaptor.forClass(BuiltQuery.class);
        verify(storeClient).exec(eq(context), eq(MetricHistoryWriter.HISTORY_TABLE), captor.capture());
        assertThat(captor.getValue().getSql())
            .startsWith("INSERT INTO metric_history (MetricId, Timestamp, MaxBlockNumberState, ")
            .doesNotContain("GroupByKey")
            .contains("/4 + __strata_min")
            .endsWith("FROM (SELECT x FROM logs) AS innerSelect");
    }
}
