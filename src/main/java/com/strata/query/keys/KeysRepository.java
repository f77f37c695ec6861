package com.strata.query.keys;

import com.strata.domain.DateRange;
import com.strata.domain.KeyType;
import com.strata.domain.KeyValueSuggestion;
import com.strata.domain.QueryKey;
import com.strata.domain.ValueSuggestion;
import com.strata.query.QueryLimits;
import com.strata.query.SelectBuilder;
import com.strata.query.UnionAll;
import com.strata.storage.StoreClient;
import com.strata.storage.StoreContext;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Key and value listings served from the pre-aggregated daily key tables.
 *
 * Every query is guarded by a {@code max_rows_to_read} setting.
 */
@Repository
public class KeysRepository {

    public static final String EVENT_KEYS_TABLE = "event_keys";
    public static final String LOG_KEYS_TABLE = "log_keys";
    public static final String TRACE_KEYS_TABLE = "trace_keys";
    public static final String SESSION_KEYS_TABLE = "session_keys";
    public static final String EVENT_KEY_VALUES_TABLE = "event_key_values";
    public static final String LOG_KEY_VALUES_TABLE = "log_key_values";
    public static final String TRACE_KEY_VALUES_TABLE = "trace_key_values";
    /** Legacy session fields table, one row per session and field. */
    public static final String FIELDS_TABLE = "fields";

    static final String MAX_ROWS_TO_READ = "max_rows_to_read";
    static final int KEYS_LIMIT = 25;
    static final int VALUES_LIMIT = 500;
    static final int SUGGESTIONS_PER_KEY = 5;

    private static final List<String> ALL_KEY_TABLES =
        List.of(EVENT_KEYS_TABLE, LOG_KEYS_TABLE, TRACE_KEYS_TABLE, SESSION_KEYS_TABLE);
    private static final List<String> ALL_KEY_VALUE_TABLES =
        List.of(EVENT_KEY_VALUES_TABLE, LOG_KEY_VALUES_TABLE, TRACE_KEY_VALUES_TABLE);

    private final StoreClient storeClient;
    private final DefaultKeys defaultKeys;
    private final QueryLimits limits;

    public KeysRepository(StoreClient storeClient, DefaultKeys defaultKeys, QueryLimits limits) {
        this.storeClient = storeClient;
        this.defaultKeys = defaultKeys;
        this.limits = limits;
    }

    /**
     * Most used keys of one key table, optionally filtered by substring, type
     * and event name.
     */
    public List<QueryKey> keysAggregated(StoreContext context, String table, int projectId, DateRange dateRange,
                                         String query, KeyType type, String event) {
        SelectBuilder sb = new SelectBuilder();
        sb.select("Key, Type, sum(Count)")
            .from(table)
            .where(sb.equal("ProjectId", projectId))
            .where("Day >= toStartOfDay(" + sb.var(dateRange.getStartDate()) + ")")
            .where("Day <= toStartOfDay(" + sb.var(dateRange.getEndDate()) + ")");
        if (query != null && !query.isEmpty()) {
            sb.where("Key ILIKE " + sb.var("%" + query + "%"));
        }
        if (type == KeyType.NUMERIC) {
            sb.where(sb.equal("Type", type.getValue()));
        }
        if (event != null && !event.isEmpty()) {
            sb.where(sb.or(sb.equal("Event", event), "Event = ''"));
        }
        sb.groupBy("1, 2").orderBy("3 DESC, 1").limit(KEYS_LIMIT);

        return storeClient.query(keysContext(context), table, sb.build(),
            (rs, rowNum) -> new QueryKey(rs.getString(1), KeyType.fromValue(rs.getString(2))));
    }

    /**
     * Most frequent values of {@code key} in one key-value table.
     */
    public List<String> keyValuesAggregated(StoreContext context, String table, int projectId, String key,
                                            DateRange dateRange, String query, Integer limit, String event) {
        SelectBuilder sb = new SelectBuilder();
        sb.select("Value, sum(Count)")
            .from(table)
            .where(sb.equal("ProjectId", projectId))
            .where(sb.equal("Key", key))
            .where("Value ILIKE " + sb.var("%" + (query == null ? "" : query) + "%"))
            .where("Day >= toStartOfDay(" + sb.var(dateRange.getStartDate()) + ")")
            .where("Day <= toStartOfDay(" + sb.var(dateRange.getEndDate()) + ")");
        if (event != null && !event.isEmpty()) {
            sb.where(sb.or(sb.equal("Event", event), "Event = ''"));
        }
        sb.groupBy("1").orderBy("2 DESC, 1").limit(limit == null ? VALUES_LIMIT : limit);

        return storeClient.query(context.withSetting(MAX_ROWS_TO_READ, limits.getKeyValuesMaxRows()), table,
            sb.build(), (rs, rowNum) -> rs.getString(1));
    }

    /**
     * Top values of each key, ranked by count. Results follow the order of
     * {@code keys}; a key without values gets an empty list.
     */
    public List<KeyValueSuggestion> keyValueSuggestions(StoreContext context, String valuesTable, int projectId,
                                                        DateRange dateRange, List<String> keys) {
        SelectBuilder ranked = new SelectBuilder();
        ranked.select("Key, Value, sum(Count) OVER (PARTITION BY Key) AS KeyCount, sum(Count) AS ValueCount, "
                + "row_number() OVER (PARTITION BY Key ORDER BY sum(Count) DESC) AS Rank")
            .from(valuesTable)
            .where(ranked.equal("ProjectId", projectId))
            .where("Day >= toStartOfDay(" + ranked.var(dateRange.getStartDate()) + ")")
            .where("Day <= toStartOfDay(" + ranked.var(dateRange.getEndDate()) + ")")
            .where(ranked.in("Key", keys))
            .groupBy("Key, Value, Count");

        SelectBuilder sb = new SelectBuilder();
        sb.select("Key", "Value", "KeyCount", "ValueCount", "Rank")
            .from(ranked, "ranked_keys")
            .where("Rank <= " + SUGGESTIONS_PER_KEY)
            .orderBy("Key, Rank");

        List<Map.Entry<String, ValueSuggestion>> rows = storeClient.query(
            context.withSetting(MAX_ROWS_TO_READ, limits.getKeyValuesMaxRows()), valuesTable, sb.build(),
            (rs, rowNum) -> Map.entry(rs.getString(1),
                new ValueSuggestion(rs.getString(2), rs.getLong(4), rs.getLong(5))));

        Map<String, List<ValueSuggestion>> valuesByKey = new LinkedHashMap<>();
        for (Map.Entry<String, ValueSuggestion> row : rows) {
            valuesByKey.computeIfAbsent(row.getKey(), k -> new ArrayList<>()).add(row.getValue());
        }

        List<KeyValueSuggestion> suggestions = new ArrayList<>(keys.size());
        for (String key : keys) {
            suggestions.add(new KeyValueSuggestion(key, valuesByKey.getOrDefault(key, List.of())));
        }
        return suggestions;
    }

    /**
     * Most used keys across events, logs, traces and sessions. Each table's
     * counts are normalised to its own most used key, reserved keys are folded
     * in with weight 1.0, and the summed weights rank the result.
     */
    public List<QueryKey> allKeys(StoreContext context, int projectId, DateRange dateRange, String query,
                                  KeyType type) {
        List<SelectBuilder> selects = new ArrayList<>();
        for (String table : ALL_KEY_TABLES) {
            SelectBuilder sb = new SelectBuilder();
            sb.select("Key, sum(Count) / max(sum(Count)) OVER () AS PctCount")
                .from(table)
                .where(sb.equal("ProjectId", projectId))
                .where("Day >= toStartOfDay(" + sb.var(dateRange.getStartDate()) + ")")
                .where("Day <= toStartOfDay(" + sb.var(dateRange.getEndDate()) + ")");
            if (query != null && !query.isEmpty()) {
                sb.where("Key ILIKE " + sb.var("%" + query + "%"));
            }
            if (type == KeyType.NUMERIC) {
                sb.where(sb.equal("Type", type.getValue()));
            }
            sb.groupBy("1").orderBy("2 DESC, 1").limit(KEYS_LIMIT);
            selects.add(sb);
        }

        SelectBuilder sb = new SelectBuilder();
        sb.select("Key, sum(PctCount)")
            .from(UnionAll.of(selects), "inner")
            .groupBy("1");

        List<WeightedKey> weighted = new ArrayList<>(storeClient.query(keysContext(context),
            String.join(",", ALL_KEY_TABLES), sb.build(),
            (rs, rowNum) -> new WeightedKey(new QueryKey(rs.getString(1), KeyType.STRING), rs.getDouble(2))));
        for (QueryKey key : defaultKeys.matching(query)) {
            weighted.add(new WeightedKey(key, 1.0));
        }

        Map<String, Double> totals = new LinkedHashMap<>();
        for (WeightedKey key : weighted) {
            totals.merge(key.key.getName(), key.weight, Double::sum);
        }
        List<Map.Entry<String, Double>> ranked = new ArrayList<>(totals.entrySet());
        ranked.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()));

        List<QueryKey> keys = new ArrayList<>();
        for (Map.Entry<String, Double> entry : ranked.subList(0, Math.min(KEYS_LIMIT, ranked.size()))) {
            keys.add(new QueryKey(entry.getKey(), KeyType.STRING));
        }
        return keys;
    }

    /**
     * Most frequent values of {@code key} across the key-value tables and the
     * legacy session fields table, weighted like {@link #allKeys}.
     */
    public List<String> allKeyValues(StoreContext context, int projectId, String key, DateRange dateRange,
                                     String query, Integer limit) {
        int limitCount = limit == null ? VALUES_LIMIT : limit;
        String pattern = "%" + (query == null ? "" : query) + "%";

        List<SelectBuilder> selects = new ArrayList<>();
        for (String table : ALL_KEY_VALUE_TABLES) {
            SelectBuilder sb = new SelectBuilder();
            sb.select("Value, sum(Count) / max(sum(Count)) OVER () AS PctCount")
                .from(table)
                .where(sb.equal("ProjectId", projectId))
                .where(sb.equal("Key", key))
                .where("Value ILIKE " + sb.var(pattern))
                .where("Day >= toStartOfDay(" + sb.var(dateRange.getStartDate()) + ")")
                .where("Day <= toStartOfDay(" + sb.var(dateRange.getEndDate()) + ")")
                .groupBy("1")
                .orderBy("2 DESC, 1")
                .limit(limitCount);
            selects.add(sb);
        }

        SelectBuilder fields = new SelectBuilder();
        fields.select("Value, count() / max(count()) OVER () AS PctCount")
            .from(FIELDS_TABLE)
            .where(fields.equal("ProjectID", projectId))
            .where(fields.equal("Name", key))
            .where("Value ILIKE " + fields.var(pattern))
            .where(fields.greaterEqualThan("SessionCreatedAt", dateRange.getStartDate()))
            .where(fields.lessEqualThan("SessionCreatedAt", dateRange.getEndDate()))
            .groupBy("1")
            .orderBy("2 DESC, 1")
            .limit(limitCount);
        selects.add(fields);

        SelectBuilder sb = new SelectBuilder();
        sb.select("Value, sum(PctCount)")
            .from(UnionAll.of(selects), "inner")
            .groupBy("1")
            .orderBy("2 DESC")
            .limit(limitCount);

        return storeClient.query(context.withSetting(MAX_ROWS_TO_READ, limits.getAllKeyValuesMaxRows()),
            FIELDS_TABLE, sb.build(), (rs, rowNum) -> rs.getString(1));
    }

    private StoreContext keysContext(StoreContext context) {
        return context.withSetting(MAX_ROWS_TO_READ, limits.getKeysMaxRows());
    }

    private static final class WeightedKey {
        private final QueryKey key;
        private final double weight;

        WeightedKey(QueryKey key, double weight) {
            this.key = key;
            this.weight = weight;
        }
    }
}
