package com.strata.domain;

/**
 * Last aggregated block number of one table partition
 */
public class BlockNumberInfo {
    private final String partition;
    private final long lastBlockNumber;

    public BlockNumberInfo(String partition, long lastBlockNumber) {
        this.partition = partition;
        this.lastBlockNumber = lastBlockNumber;
    }

    public String getPartition() {
        return partition;
    }

    public long getLastBlockNumber() {
        return lastBlockNumber;
    }
}
