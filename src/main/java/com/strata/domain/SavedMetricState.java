package com.strata.domain;

import java.util.List;

/**
 * Target of an incremental metric computation. When present, aggregate
 * state rows are written to the history table instead of being returned.
 */
public class SavedMetricState {
    private final String metricId;
    private final List<BlockNumberInfo> blockNumberInfo;

    public SavedMetricState(String metricId, List<BlockNumberInfo> blockNumberInfo) {
        this.metricId = metricId;
        this.blockNumberInfo = blockNumberInfo == null ? List.of() : List.copyOf(blockNumberInfo);
    }

    public String getMetricId() {
        return metricId;
    }

    public List<BlockNumberInfo> getBlockNumberInfo() {
        return blockNumberInfo;
    }
}
