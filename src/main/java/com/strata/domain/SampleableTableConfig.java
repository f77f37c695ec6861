package com.strata.domain;

/**
 * A primary table paired with its sampling companion. A target row budget of
 * zero disables sampling.
 */
public class SampleableTableConfig {
    private final TableConfig tableConfig;
    private final TableConfig samplingTableConfig;
    private final long sampleSizeRows;

    public SampleableTableConfig(TableConfig tableConfig, TableConfig samplingTableConfig, long sampleSizeRows) {
        this.tableConfig = tableConfig;
        this.samplingTableConfig = samplingTableConfig;
        this.sampleSizeRows = sampleSizeRows;
    }

    public static SampleableTableConfig unsampled(TableConfig tableConfig) {
        return new SampleableTableConfig(tableConfig, tableConfig, 0);
    }

    public TableConfig getTableConfig() {
        return tableConfig;
    }

    public TableConfig getSamplingTableConfig() {
        return samplingTableConfig;
    }

    public long getSampleSizeRows() {
        return sampleSizeRows;
    }

    public boolean isSamplingEnabled() {
        return sampleSizeRows > 0 && samplingTableConfig != null;
    }
}
