package com.strata.query.logs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.domain.Connection;
import com.strata.domain.LogLevel;
import com.strata.domain.LogLine;
import com.strata.domain.QueryInput;
import com.strata.domain.SampleableTableConfig;
import com.strata.domain.TableConfig;
import com.strata.query.AttributeScope;
import com.strata.query.Pagination;
import com.strata.query.QueryBuilder;
import com.strata.query.QueryLimits;
import com.strata.query.SelectBuilder;
import com.strata.query.SelectPlan;
import com.strata.query.filter.FilterMatcher;
import com.strata.query.filter.FilterOperation;
import com.strata.query.filter.SearchQueryParser;
import com.strata.query.objects.ObjectReader;
import com.strata.storage.DefaultTableConfigRegistry;
import com.strata.storage.StoreClient;
import com.strata.storage.StoreContext;
import com.strata.storage.TableConfigRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Log listings: paged log rows, raw log lines with JSON labels, and
 * re-checking fetched rows against a search query.
 */
@Service
public class LogsReader {
    private static final Logger logger = LoggerFactory.getLogger(LogsReader.class);

    private final StoreClient storeClient;
    private final ObjectReader objectReader;
    private final QueryBuilder queryBuilder;
    private final SearchQueryParser searchQueryParser;
    private final TableConfigRegistry registry;
    private final ObjectMapper objectMapper;
    private final QueryLimits limits;
    private final FilterMatcher<LogRow> matcher = new FilterMatcher<>(LogRow.FIELDS);

    public LogsReader(StoreClient storeClient, ObjectReader objectReader, QueryBuilder queryBuilder,
                      SearchQueryParser searchQueryParser, TableConfigRegistry registry, ObjectMapper objectMapper,
                      QueryLimits limits) {
        this.storeClient = storeClient;
        this.objectReader = objectReader;
        this.queryBuilder = queryBuilder;
        this.searchQueryParser = searchQueryParser;
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.limits = limits;
    }

    public Connection<LogRow> readLogs(StoreContext context, int projectId, QueryInput params, Pagination pagination) {
        SampleableTableConfig configs = registry.sampleable(DefaultTableConfigRegistry.LOGS, limits.getSamplingRows());
        return objectReader.readObjects(context, configs.getTableConfig(), configs.getSamplingTableConfig(),
            projectId, params, pagination, LogRow.EDGE_MAPPER);
    }

    /**
     * Whether an already fetched row satisfies {@code query}.
     */
    public boolean matches(LogRow row, String query) {
        TableConfig config = registry.get(DefaultTableConfigRegistry.LOGS);
        List<FilterOperation> filters = searchQueryParser.parse(query, config);
        return matcher.matches(row, config, filters);
    }

    /**
     * Up to the configured number of log lines of one project, with all
     * attribute columns merged into nested JSON labels.
     */
    public List<LogLine> logLines(StoreContext context, TableConfig config, int projectId, QueryInput params) {
        List<String> attributeColumns = new ArrayList<>();
        config.getAttributesColumns().forEach(mapping -> attributeColumns.add(mapping.getColumn()));

        List<String> columns = List.of(
            "Timestamp",
            column(config.getBodyColumn(), "Body"),
            column(config.getSeverityColumn(), "Severity"),
            column(attributeColumns.isEmpty() ? null : "mapConcat(" + String.join(", ", attributeColumns) + ")",
                "Labels"));

        SelectPlan plan = queryBuilder.buildSelect(config, columns, List.of(projectId), params,
            Pagination.countOnly());
        SelectBuilder sb = plan.getBuilder();
        AttributeScope.apply(sb, config, plan.getAttributeFields(), List.of(projectId), params.getDateRange());
        sb.limit(limits.getLogLinesLimit());

        List<LogLine> lines = storeClient.query(context, config.getTableName(), sb.build(), (rs, rowNum) -> {
            Timestamp timestamp = rs.getTimestamp("Timestamp");
            String severity = rs.getString("Severity");
            return new LogLine(
                timestamp == null ? null : timestamp.toInstant(),
                rs.getString("Body"),
                severity == null || severity.isEmpty() ? null : LogLevel.fromSeverity(severity),
                labels(LogRow.stringMap(rs.getObject("Labels"))));
        });
        logger.debug("Read {} log lines from {}", lines.size(), config.getTableName());
        return lines;
    }

    String labels(Map<String, String> attributes) {
        try {
            return objectMapper.writeValueAsString(expand(attributes));
        } catch (JsonProcessingException e) {
            logger.error("Error serializing log labels: {}", e.getMessage());
            throw new RuntimeException("Log label serialization failed", e);
        }
    }

    /**
     * Nests dotted keys: {@code a.b=1} becomes {@code {"a":{"b":"1"}}}. Keys
     * that are both a value and a prefix of another key keep the flat map.
     */
    static Map<String, Object> expand(Map<String, String> attributes) {
        Map<String, Object> nested = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            if (!put(nested, entry.getKey().split("\\."), entry.getValue())) {
                return new LinkedHashMap<>(attributes);
            }
        }
        return nested;
    }

    @SuppressWarnings("unchecked")
    private static boolean put(Map<String, Object> target, String[] path, String value) {
        Map<String, Object> current = target;
        for (int i = 0; i < path.length - 1; i++) {
            Object next = current.computeIfAbsent(path[i], k -> new LinkedHashMap<String, Object>());
            if (!(next instanceof Map)) {
                return false;
            }
            current = (Map<String, Object>) next;
        }
        String leaf = path[path.length - 1];
        if (current.containsKey(leaf)) {
            return false;
        }
        current.put(leaf, value);
        return true;
    }

    private static String column(String expression, String alias) {
        return (expression == null || expression.isEmpty() ? "null" : expression) + " AS " + alias;
    }
}
