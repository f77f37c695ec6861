package com.strata.query.metrics;

import com.strata.domain.SampleableTableConfig;
import com.strata.domain.TableConfig;

import java.util.Locale;

/**
 * Which table a metric request reads: the primary table, or the sampling
 * companion read at a fixed sample ratio. Chosen once per request.
 */
public final class TableChoice {
    private static final TableChoice PRIMARY = new TableChoice(0.0);

    private final double ratio;

    private TableChoice(double ratio) {
        this.ratio = ratio;
    }

    public static TableChoice primary() {
        return PRIMARY;
    }

    public static TableChoice sampled(double ratio) {
        if (!(ratio > 0.0)) {
            throw new IllegalArgumentException("Sample ratio must be positive: " + ratio);
        }
        return new TableChoice(Math.min(ratio, 1.0));
    }

    public boolean isSampled() {
        return ratio > 0.0;
    }

    public double getRatio() {
        return ratio;
    }

    /**
     * The table configuration to query. A sampled choice reads the sampling
     * table with a {@code SAMPLE} clause and scales counts by the sample factor.
     */
    public TableConfig resolve(SampleableTableConfig configs) {
        if (!isSampled()) {
            return configs.getTableConfig();
        }
        TableConfig sampling = configs.getSamplingTableConfig();
        return sampling.toBuilder()
            .tableName(String.format(Locale.ROOT, "%s SAMPLE %f", sampling.getTableName(), ratio))
            .sampled(true)
            .build();
    }

    @Override
    public String toString() {
        return isSampled() ? "Sampled(" + ratio + ")" : "Primary";
    }
}
