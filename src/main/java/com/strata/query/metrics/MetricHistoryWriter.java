package com.strata.query.metrics;

import com.strata.domain.BlockNumberInfo;
import com.strata.domain.MetricAggregator;
import com.strata.domain.MetricsRequest;
import com.strata.domain.SavedMetricState;
import com.strata.query.BuiltQuery;
import com.strata.query.SelectBuilder;
import com.strata.storage.StoreClient;
import com.strata.storage.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Persists partial aggregate states of a metric into the history table so
 * later reads can resume from the last block number seen per partition.
 */
@Component
public class MetricHistoryWriter {
    private static final Logger logger = LoggerFactory.getLogger(MetricHistoryWriter.class);

    public static final String HISTORY_TABLE = "metric_history";
    public static final String MAX_BLOCK_NUMBER_ALIAS = "max_block_number";

    private final StoreClient storeClient;

    public MetricHistoryWriter(StoreClient storeClient) {
        this.storeClient = storeClient;
    }

    /**
     * Restricts {@code sb} to data parts written after the saved high-water
     * marks. No-op without saved block numbers.
     */
    public static void applyBlockFilter(SelectBuilder sb, String tableName, SavedMetricState state) {
        if (state == null || state.getBlockNumberInfo().isEmpty()) {
            return;
        }

        SelectBuilder parts = new SelectBuilder();
        List<String> partFilters = new ArrayList<>();
        for (BlockNumberInfo info : state.getBlockNumberInfo()) {
            partFilters.add(parts.and(
                parts.equal("partition", info.getPartition()),
                parts.greaterThan("max_block_number", info.getLastBlockNumber())));
        }
        parts.select("name")
            .from("system.parts")
            .where(parts.equal("table", tableName))
            .where("active")
            .where(parts.or(partFilters));
        sb.where(sb.in("_part", parts));

        List<String> blockFilters = new ArrayList<>();
        for (BlockNumberInfo info : state.getBlockNumberInfo()) {
            blockFilters.add(sb.and(
                sb.equal("_partition_id", info.getPartition().replace("-", "")),
                sb.greaterThan("_block_number", info.getLastBlockNumber())));
        }
        sb.where(sb.or(blockFilters));
    }

    public void save(StoreContext context, SelectBuilder stateQuery, MetricsRequest request, int bucketCount) {
        BuiltQuery insert = buildInsert(stateQuery, request, bucketCount);
        logger.debug("Saving metric history for {}", request.getSavedMetricState().getMetricId());
        storeClient.exec(context, HISTORY_TABLE, insert);
    }

    BuiltQuery buildInsert(SelectBuilder stateQuery, MetricsRequest request, int bucketCount) {
        MetricAggregator aggregator = request.getExpressions().isEmpty()
            ? MetricAggregator.COUNT
            : request.getExpressions().get(0).getAggregator();

        List<String> insertColumns = new ArrayList<>(List.of("MetricId", "Timestamp", "MaxBlockNumberState",
            AggregatorFunctions.stateColumn(aggregator)));

        SelectBuilder sb = new SelectBuilder();
        List<String> selectColumns = new ArrayList<>(List.of(
            sb.var(request.getSavedMetricState().getMetricId()),
            String.format("fromUnixTimestamp(toInt64(%s*(%s-%s)/%d + %s))", Bucketing.BUCKET_INDEX_ALIAS,
                Bucketing.MAX_ALIAS, Bucketing.MIN_ALIAS, bucketCount, Bucketing.MIN_ALIAS),
            MAX_BLOCK_NUMBER_ALIAS,
            "metric_value0"));
        if (!request.getGroupBy().isEmpty()) {
            insertColumns.add("GroupByKey");
            selectColumns.add("g0");
        }
        sb.select(selectColumns).from(stateQuery, "innerSelect");

        return sb.build().withPrefix("INSERT INTO " + HISTORY_TABLE + " (" + String.join(", ", insertColumns) + ") ");
    }
}
