package com.strata.storage;

import com.strata.query.BuiltQuery;
import com.strata.query.QueryCancelledException;
import com.strata.query.QueryExecutionException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for JdbcStoreClient
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("JdbcStoreClient Tests")
class JdbcStoreClientTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private StoreMetrics storeMetrics;
    private JdbcStoreClient client;

    @BeforeEach
    void setUp() {
        storeMetrics = new StoreMetrics(new SimpleMeterRegistry());
        storeMetrics.init();
        client = new JdbcStoreClient(jdbcTemplate, storeMetrics);
    }

    @Test
    @DisplayName("Should append context settings as a trailing SETTINGS clause")
    void shouldAppendSettings() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("max_rows_to_read", 1000000L);
        settings.put("SQL_strata_project_id", "7");
        settings.put("note", "it's");

        String sql = JdbcStoreClient.withSettings("SELECT 1", settings);

        assertThat(sql).isEqualTo(
            "SELECT 1\nSETTINGS max_rows_to_read = 1000000, SQL_strata_project_id = '7', note = 'it\\'s'");
        assertThat(JdbcStoreClient.withSettings("SELECT 1", Map.of())).isEqualTo("SELECT 1");
    }

    @Test
    @DisplayName("Should keep the SETTINGS clause out of a trailing line comment")
    void shouldAppendSettingsAfterLineComment() {
        Map<String, Object> settings = Map.of("SQL_strata_project_id", "7");

        String commented = JdbcStoreClient.withSettings("SELECT count() FROM logs -- totals", settings);
        String terminated = JdbcStoreClient.withSettings("SELECT count() FROM logs; \n", settings);

        assertThat(commented).isEqualTo("SELECT count() FROM logs -- totals\nSETTINGS SQL_strata_project_id = '7'");
        assertThat(terminated).isEqualTo("SELECT count() FROM logs\nSETTINGS SQL_strata_project_id = '7'");
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should prepare the statement with settings and return mapped rows")
    void shouldRunQueryWithSettings() throws Exception {
        // Given: The template runs the statement creator against a mock connection
        Connection connection = mock(Connection.class);
        PreparedStatement statement = mock(PreparedStatement.class);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(jdbcTemplate.query(any(PreparedStatementCreator.class), any(RowMapper.class))).thenAnswer(invocation -> {
            PreparedStatementCreator creator = invocation.getArgument(0);
            creator.createPreparedStatement(connection);
            return List.of("row");
        });

        // When: Querying with a context setting
        StoreContext context = StoreContext.create().withSetting("max_rows_to_read", 10L);
        List<String> rows = client.query(context, "logs", BuiltQuery.raw("SELECT Body FROM logs"),
            (rs, rowNum) -> rs.getString(1));

        // Then: The settings reach the prepared SQL and the metrics record success
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(connection).prepareStatement(sql.capture());
        assertThat(sql.getValue()).isEqualTo("SELECT Body FROM logs\nSETTINGS max_rows_to_read = 10");
        assertThat(rows).containsExactly("row");
        assertThat(storeMetrics.getQueriesFailed().count()).isZero();
    }

    @Test
    @DisplayName("Should fail fast on a cancelled context without touching the store")
    void shouldRejectCancelledContext() {
        StoreContext context = StoreContext.create();
        context.cancel();

        assertThatThrownBy(() -> client.exec(context, "metric_history", BuiltQuery.raw("INSERT INTO x SELECT 1")))
            .isInstanceOf(QueryCancelledException.class);
        verifyNoInteractions(jdbcTemplate);
        assertThat(storeMetrics.getQueriesCancelled().count()).isEqualTo(1.0);
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should abort the in-flight statement when the request is cancelled")
    void shouldCancelInFlightStatement() throws Exception {
        // Given: The store fails after the request is cancelled mid-flight
        StoreContext context = StoreContext.create();
        Connection connection = mock(Connection.class);
        PreparedStatement statement = mock(PreparedStatement.class);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(jdbcTemplate.query(any(PreparedStatementCreator.class), any(RowMapper.class))).thenAnswer(invocation -> {
            PreparedStatementCreator creator = invocation.getArgument(0);
            creator.createPreparedStatement(connection);
            context.cancel();
            throw new DataAccessResourceFailureException("aborted");
        });

        // When / Then: The statement is cancelled and the failure surfaces as a cancellation
        assertThatThrownBy(() -> client.query(context, "logs", BuiltQuery.raw("SELECT 1"), (rs, rowNum) -> 1))
            .isInstanceOf(QueryCancelledException.class);
        verify(statement).cancel();
        assertThat(storeMetrics.getQueriesFailed().count()).isZero();
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should wrap store failures with the table and statement")
    void shouldWrapFailures() {
        when(jdbcTemplate.query(any(PreparedStatementCreator.class), any(RowMapper.class)))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> client.query(StoreContext.create(), "traces", BuiltQuery.raw("SELECT 2"),
            (rs, rowNum) -> 1))
            .isInstanceOf(QueryExecutionException.class)
            .isNotInstanceOf(QueryCancelledException.class)
            .hasMessageContaining("[Table: traces]")
            .hasMessageContaining("[Query: SELECT 2]");
        assertThat(storeMetrics.getQueriesFailed().count()).isEqualTo(1.0);
    }
}
