package com.strata.query.metrics;

import com.strata.domain.SampleableTableConfig;
import com.strata.domain.TableConfig;
import com.strata.storage.DefaultTableConfigRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for TableChoice
 */
@DisplayName("TableChoice Tests")
class TableChoiceTest {

    private final SampleableTableConfig logs = new DefaultTableConfigRegistry()
        .sampleable(DefaultTableConfigRegistry.LOGS, 1000);

    @Test
    @DisplayName("Should read the primary table unchanged")
    void shouldResolvePrimary() {
        TableChoice choice = TableChoice.primary();

        assertThat(choice.isSampled()).isFalse();
        assertThat(choice.resolve(logs)).isSameAs(logs.getTableConfig());
    }

    @Test
    @DisplayName("Should read the sampling table with a SAMPLE clause")
    void shouldResolveSampled() {
        TableConfig config = TableChoice.sampled(0.5).resolve(logs);

        assertThat(config.getTableName()).isEqualTo("logs_sampling SAMPLE 0.500000");
        assertThat(config.isSampled()).isTrue();
        assertThat(config.getResource()).isEqualTo(DefaultTableConfigRegistry.LOGS);
    }

    @Test
    @DisplayName("Should cap the sample ratio at one")
    void shouldCapRatio() {
        assertThat(TableChoice.sampled(3.0).getRatio()).isEqualTo(1.0);
        assertThat(TableChoice.sampled(0.25).getRatio()).isEqualTo(0.25);
    }

    @Test
    @DisplayName("Should reject a non-positive sample ratio")
    void shouldRejectInvalidRatio() {
        assertThatThrownBy(() -> TableChoice.sampled(0.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TableChoice.sampled(Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
