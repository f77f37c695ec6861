package com.strata.query.metrics;

import com.strata.domain.DateRange;
import com.strata.domain.SampleableTableConfig;
import com.strata.domain.TableConfig;
import com.strata.query.BuiltQuery;
import com.strata.query.SelectBuilder;
import com.strata.query.UnionAll;
import com.strata.storage.StoreClient;
import com.strata.storage.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Estimates table sizes with {@code EXPLAIN ESTIMATE} to decide whether a
 * metric request should read the sampling table.
 */
@Component
public class SamplingEstimator {
    private static final Logger logger = LoggerFactory.getLogger(SamplingEstimator.class);

    private static final RowMapper<SamplingStats> STATS_MAPPER = (rs, rowNum) -> new SamplingStats(
        rs.getString("database"),
        rs.getString("table"),
        rs.getLong("parts"),
        rs.getLong("rows"),
        rs.getLong("marks"));

    private final StoreClient storeClient;

    public SamplingEstimator(StoreClient storeClient) {
        this.storeClient = storeClient;
    }

    /**
     * Picks the sampling table when the primary table holds more rows than the
     * configured budget over the range; the ratio then targets that budget.
     */
    public TableChoice choose(StoreContext context, SampleableTableConfig configs, List<Integer> projectIds,
                              DateRange dateRange) {
        if (configs == null || !configs.isSamplingEnabled()) {
            return TableChoice.primary();
        }
        String primaryTable = configs.getTableConfig().getTableName();
        String samplingTable = configs.getSamplingTableConfig().getTableName();
        Map<String, SamplingStats> stats = estimate(context,
            List.of(configs.getTableConfig(), configs.getSamplingTableConfig()), projectIds, dateRange);

        long primaryRows = rows(stats, primaryTable);
        long samplingRows = rows(stats, samplingTable);
        if (primaryRows <= configs.getSampleSizeRows() || samplingRows == 0) {
            logger.debug("Reading {} unsampled ({} estimated rows)", primaryTable, primaryRows);
            return TableChoice.primary();
        }
        TableChoice choice = TableChoice.sampled((double) configs.getSampleSizeRows() / samplingRows);
        logger.debug("Reading {} at {} ({} estimated rows in {})", samplingTable, choice, primaryRows, primaryTable);
        return choice;
    }

    public Map<String, SamplingStats> estimate(StoreContext context, List<TableConfig> tables,
                                               List<Integer> projectIds, DateRange dateRange) {
        List<SelectBuilder> selects = new ArrayList<>();
        List<String> tableNames = new ArrayList<>();
        for (TableConfig table : tables) {
            if (tableNames.contains(table.getTableName())) {
                continue;
            }
            tableNames.add(table.getTableName());

            SelectBuilder sb = new SelectBuilder();
            sb.select("1")
                .from(table.getTableName())
                .where(sb.in(table.getProjectIdColumn(), new ArrayList<>(new LinkedHashSet<>(projectIds))))
                .where(sb.greaterEqualThan("Timestamp", dateRange.getStartDate()))
                .where(sb.lessEqualThan("Timestamp", dateRange.getEndDate()));
            selects.add(sb);
        }

        BuiltQuery query = UnionAll.of(selects).build().withPrefix("EXPLAIN ESTIMATE ");
        Map<String, SamplingStats> byTable = new LinkedHashMap<>();
        for (SamplingStats stats : storeClient.query(context, String.join(",", tableNames), query, STATS_MAPPER)) {
            byTable.put(stats.getTable(), stats);
        }
        return byTable;
    }

    private static long rows(Map<String, SamplingStats> stats, String table) {
        SamplingStats tableStats = stats.get(table);
        return tableStats == null ? 0 : tableStats.getRows();
    }
}
