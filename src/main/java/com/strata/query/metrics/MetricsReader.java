package com.strata.query.metrics;

import com.strata.domain.DateRange;
import com.strata.domain.MetricAggregator;
import com.strata.domain.MetricBucketBy;
import com.strata.domain.MetricExpression;
import com.strata.domain.MetricsBuckets;
import com.strata.domain.MetricsRequest;
import com.strata.domain.QueryInput;
import com.strata.domain.TableConfig;
import com.strata.query.AttributeResolver;
import com.strata.query.AttributeScope;
import com.strata.query.BuiltQuery;
import com.strata.query.InvalidQueryException;
import com.strata.query.Pagination;
import com.strata.query.QueryBuilder;
import com.strata.query.QueryLimits;
import com.strata.query.SelectBuilder;
import com.strata.query.SelectPlan;
import com.strata.query.decode.RowDecoder;
import com.strata.query.rewrite.SqlRewriter;
import com.strata.storage.ResultRows;
import com.strata.storage.StoreClient;
import com.strata.storage.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Entry point for metric bucket computation.
 *
 * Raw SQL requests are rewritten and executed on the read-only pool with the
 * caller's project id attached as a server-side setting. Structured requests
 * are compiled into a bucketed aggregate query of up to three levels: the
 * scoped row selection computing bucket index, metric inputs and groups; the
 * per bucket and group aggregation; and, for top-N requests, a ranking layer
 * keeping the highest ranked groups.
 */
@Service
public class MetricsReader {
    private static final Logger logger = LoggerFactory.getLogger(MetricsReader.class);

    /** Server-side setting carrying the project id of raw SQL requests. */
    public static final String PROJECT_ID_SETTING = "SQL_strata_project_id";
    /** Attribute counted by the distinct-key aggregator. */
    public static final String DISTINCT_KEY_ATTRIBUTE = "strata.key";
    static final int DEFAULT_LIMIT = 10;
    static final int DEFAULT_RANGE_DAYS = 30;

    private final StoreClient storeClient;
    private final StoreClient readonlyStoreClient;
    private final QueryBuilder queryBuilder;
    private final SqlRewriter sqlRewriter;
    private final SamplingEstimator samplingEstimator;
    private final MetricHistoryWriter historyWriter;
    private final QueryLimits limits;
    private final Clock clock;

    public MetricsReader(StoreClient storeClient,
                         @Qualifier("readonlyStoreClient") StoreClient readonlyStoreClient,
                         QueryBuilder queryBuilder,
                         SqlRewriter sqlRewriter,
                         SamplingEstimator samplingEstimator,
                         MetricHistoryWriter historyWriter,
                         QueryLimits limits,
                         Clock clock) {
        this.storeClient = storeClient;
        this.readonlyStoreClient = readonlyStoreClient;
        this.queryBuilder = queryBuilder;
        this.sqlRewriter = sqlRewriter;
        this.samplingEstimator = samplingEstimator;
        this.historyWriter = historyWriter;
        this.limits = limits;
        this.clock = clock;
    }

    /**
     * Computes metric buckets for {@code request}. When the request carries a
     * saved metric state the aggregate states are written to the history table
     * instead and the result holds no buckets.
     *
     * @throws InvalidQueryException when the request is malformed
     */
    public MetricsBuckets readMetrics(StoreContext context, MetricsRequest request) {
        if (request.getSampleableConfig() == null) {
            throw new InvalidQueryException("A table configuration is required");
        }
        QueryInput params = scopedParams(request.getParams());
        DateRange dateRange = params.getDateRange();

        TableChoice choice = samplingEstimator.choose(context, request.getSampleableConfig(),
            request.getProjectIds(), dateRange);

        List<MetricExpression> expressions = request.getExpressions();
        if (expressions == null || expressions.isEmpty()) {
            throw new InvalidQueryException("no expressions provided");
        }

        TableConfig config = choice.resolve(request.getSampleableConfig());
        for (MetricExpression expression : expressions) {
            if (expression.getAggregator() == MetricAggregator.COUNT_DISTINCT_KEY) {
                config = config.toBuilder().defaultFilter(null).build();
                break;
            }
        }

        if (request.getSql() != null) {
            return readMetricsSql(context, request, config, dateRange);
        }
        return readMetricsBuckets(context, request, config, choice, params);
    }

    private QueryInput scopedParams(QueryInput params) {
        QueryInput scoped = new QueryInput();
        if (params != null) {
            scoped.setQuery(params.getQuery());
            scoped.setSort(params.getSort());
            scoped.setDateRange(params.getDateRange());
        }
        if (scoped.getDateRange() == null) {
            scoped.setDateRange(DateRange.lastDays(clock.instant(), DEFAULT_RANGE_DAYS));
        }
        return scoped;
    }

    private MetricsBuckets readMetricsSql(StoreContext context, MetricsRequest request, TableConfig config,
                                          DateRange dateRange) {
        List<Integer> projectIds = request.getProjectIds();
        if (projectIds == null || projectIds.size() != 1) {
            throw new InvalidQueryException(String.format("SQL queries must use 1 project id, %d found",
                projectIds == null ? 0 : projectIds.size()));
        }
        if (!dateRange.isValid()) {
            throw new InvalidQueryException("Date range start must not be after its end: " + dateRange);
        }

        String sql = sqlRewriter.rewrite(request.getSql(), config, projectIds, dateRange);
        if (sql.contains(PROJECT_ID_SETTING)) {
            throw new InvalidQueryException("User cannot modify project id setting in query");
        }
        logger.debug("Reading metrics with rewritten SQL: {}", sql);

        StoreContext scoped = context.withSetting(PROJECT_ID_SETTING, String.valueOf(projectIds.get(0)));
        ResultRows rows = readonlyStoreClient.queryRows(scoped, config.getTableName(), BuiltQuery.raw(sql));
        return RowDecoder.decode(rows);
    }

    private MetricsBuckets readMetricsBuckets(StoreContext context, MetricsRequest request, TableConfig config,
                                              TableChoice choice, QueryInput params) {
        DateRange dateRange = params.getDateRange();
        List<MetricExpression> expressions = request.getExpressions();
        List<String> groupBy = request.getGroupBy() == null ? List.of() : request.getGroupBy();
        boolean saveState = request.getSavedMetricState() != null;

        SelectPlan plan = queryBuilder.buildSelect(config, null, request.getProjectIds(), params,
            Pagination.countOnly());
        SelectBuilder inner = plan.getBuilder();
        MetricHistoryWriter.applyBlockFilter(inner, request.getSampleableConfig().getTableConfig().getTableName(),
            request.getSavedMetricState());

        Set<String> attributeFields = new LinkedHashSet<>(plan.getAttributeFields());
        BucketingInfo bucketing = Bucketing.compute(config, request, dateRange, inner, limits);
        attributeFields.addAll(bucketing.getAttributeFields());

        List<String> selectColumns = new ArrayList<>(bucketing.getSelectItems());
        if (saveState) {
            selectColumns.add(inner.as("maxState(_block_number) OVER ()", MetricHistoryWriter.MAX_BLOCK_NUMBER_ALIAS));
        }
        selectColumns.add(choice.isSampled() ? "_sample_factor" : inner.as("1.0", "_sample_factor"));

        for (int i = 0; i < expressions.size(); i++) {
            String input = metricInput(inner, config, request, expressions.get(i), attributeFields);
            selectColumns.add(inner.as(input, metricInputAlias(i)));
        }

        List<String> groupAliases = new ArrayList<>();
        for (int i = 0; i < groupBy.size(); i++) {
            String group = groupBy.get(i);
            String column = AttributeResolver.column(config, group);
            String groupExpr;
            if (column != null) {
                groupExpr = "toString(" + column + ")";
            } else {
                groupExpr = AttributeResolver.attribute(inner, config, group, "toString");
                attributeFields.add(group);
            }
            String alias = "g" + i;
            groupAliases.add(alias);
            selectColumns.add(inner.as(groupExpr, alias));
            inner.where(inner.notEqual(alias, ""));
        }

        int limitCount = request.getLimit() == null ? DEFAULT_LIMIT : Math.max(request.getLimit(), 1);
        boolean useLimit = request.getLimitAggregator() != null && !groupAliases.isEmpty()
            && limitCount != MetricsRequest.NO_LIMIT;
        if (useLimit) {
            String limitField = request.getLimitColumn() == null ? "" : request.getLimitColumn();
            String limitColumn = AttributeResolver.column(config, limitField);
            if (limitColumn == null) {
                attributeFields.add(limitField);
                limitColumn = AttributeResolver.attribute(inner, config, limitField, "toFloat64OrNull");
            }
            selectColumns.add(String.format("%s OVER (PARTITION BY %s) AS limit_metric",
                AggregatorFunctions.limit(request.getLimitAggregator(), limitColumn),
                String.join(", ", groupAliases)));
        }

        inner.select(selectColumns);
        AttributeScope.apply(inner, config, attributeFields, request.getProjectIds(), dateRange);

        SelectBuilder query = aggregate(inner, expressions, groupAliases, useLimit, saveState);
        if (useLimit) {
            query = rank(query, expressions.size(), groupAliases, limitCount, saveState);
        }
        List<String> orderBy = new ArrayList<>();
        orderBy.add(Bucketing.BUCKET_INDEX_ALIAS);
        if (useLimit) {
            orderBy.add("limit_rank");
        }
        orderBy.addAll(groupAliases);
        query.orderBy(orderBy).limit(limits.getMaxResultRows());

        if (saveState) {
            historyWriter.save(context, query, request, bucketing.getBucketCount());
            MetricsBuckets saved = new MetricsBuckets();
            saved.setBucketCount(bucketing.getBucketCount());
            return saved;
        }

        BuiltQuery built = query.build();
        List<AggregateRow> rows = storeClient.query(context, config.getTableName(), built,
            aggregateRowMapper(expressions.size(), groupAliases.size()));

        Double fallbackMin = null;
        Double fallbackMax = null;
        String bucketBy = request.getBucketBy();
        if (bucketBy == null || MetricBucketBy.TIMESTAMP.matches(bucketBy) || MetricBucketBy.NONE.matches(bucketBy)) {
            fallbackMin = (double) bucketing.getStartDate().getEpochSecond();
            fallbackMax = (double) dateRange.getEndDate().getEpochSecond();
        }

        MetricsBuckets result = new MetricsBuckets();
        result.setBuckets(BucketAssembler.assemble(rows, expressions, groupAliases.size(),
            bucketing.getBucketCount(), fallbackMin, fallbackMax));
        result.setSampleFactor(rows.isEmpty() ? 1.0 : rows.get(rows.size() - 1).getSampleFactor());
        result.setBucketCount(bucketing.getBucketCount());
        logger.debug("Read {} aggregate rows into {} buckets from {}", rows.size(), result.getBuckets().size(),
            config.getTableName());
        return result;
    }

    /**
     * Per row input of one aggregator: 1.0 for counts, the raw value for
     * distinct counts, otherwise the value as a float.
     */
    private static String metricInput(SelectBuilder sb, TableConfig config, MetricsRequest request,
                                      MetricExpression expression, Set<String> attributeFields) {
        String field = expression.getColumn() == null ? "" : expression.getColumn();
        MetricAggregator aggregator = expression.getAggregator();
        if (aggregator == MetricAggregator.COUNT || field.isEmpty()) {
            return "1.0";
        }
        if (aggregator == MetricAggregator.COUNT_DISTINCT_KEY) {
            attributeFields.add(DISTINCT_KEY_ATTRIBUTE);
            return AttributeResolver.attribute(sb, config, DISTINCT_KEY_ATTRIBUTE, "");
        }

        String known = AttributeResolver.column(config, field.toLowerCase(Locale.ROOT));
        if (aggregator == MetricAggregator.COUNT_DISTINCT) {
            if (known != null) {
                return known;
            }
            attributeFields.add(field);
            return AttributeResolver.attribute(sb, config, field, "");
        }
        if (known != null) {
            return "toFloat64(" + known + ")";
        }
        String metricColumn = request.getSampleableConfig().getTableConfig().getMetricColumn();
        if (metricColumn != null) {
            return metricColumn;
        }
        attributeFields.add(field);
        return AttributeResolver.attribute(sb, config, field, "toFloat64OrNull");
    }

    private static SelectBuilder aggregate(SelectBuilder inner, List<MetricExpression> expressions,
                                           List<String> groupAliases, boolean useLimit, boolean saveState) {
        SelectBuilder outer = new SelectBuilder();
        List<String> columns = new ArrayList<>(List.of(
            Bucketing.BUCKET_INDEX_ALIAS,
            "any(_sample_factor) AS sample_factor",
            String.format("any(%s) AS %s", Bucketing.MIN_ALIAS, Bucketing.MIN_ALIAS),
            String.format("any(%s) AS %s", Bucketing.MAX_ALIAS, Bucketing.MAX_ALIAS)));
        if (saveState) {
            columns.add("any(max_block_number) AS max_block_number");
        }
        for (int i = 0; i < expressions.size(); i++) {
            columns.add(AggregatorFunctions.aggregate(expressions.get(i).getAggregator(), metricInputAlias(i),
                true, saveState) + " AS " + metricValueAlias(i));
        }
        columns.addAll(groupAliases);
        if (useLimit) {
            columns.add(String.format("dense_rank() OVER (ORDER BY limit_metric DESC, %s) AS limit_rank",
                String.join(", ", groupAliases)));
        }

        List<String> groupBy = new ArrayList<>();
        groupBy.add(Bucketing.BUCKET_INDEX_ALIAS);
        if (useLimit) {
            groupBy.add("limit_metric");
        }
        groupBy.addAll(groupAliases);

        return outer.select(columns).from(inner, "inner").groupBy(groupBy);
    }

    private static SelectBuilder rank(SelectBuilder aggregated, int expressionCount, List<String> groupAliases,
                                      int limitCount, boolean saveState) {
        SelectBuilder ranked = new SelectBuilder();
        List<String> columns = new ArrayList<>(List.of(
            Bucketing.BUCKET_INDEX_ALIAS, "sample_factor", Bucketing.MIN_ALIAS, Bucketing.MAX_ALIAS));
        if (saveState) {
            columns.add(MetricHistoryWriter.MAX_BLOCK_NUMBER_ALIAS);
        }
        for (int i = 0; i < expressionCount; i++) {
            columns.add(metricValueAlias(i));
        }
        columns.addAll(groupAliases);
        return ranked.select(columns)
            .from(aggregated, "outer")
            .where(ranked.lessEqualThan("limit_rank", limitCount));
    }

    private static RowMapper<AggregateRow> aggregateRowMapper(int expressionCount, int groupCount) {
        return (rs, rowNum) -> {
            List<Double> values = new ArrayList<>(expressionCount);
            for (int i = 0; i < expressionCount; i++) {
                double value = rs.getDouble(5 + i);
                values.add(rs.wasNull() || Double.isNaN(value) ? null : value);
            }
            List<String> groups = new ArrayList<>(groupCount);
            for (int i = 0; i < groupCount; i++) {
                String group = rs.getString(5 + expressionCount + i);
                groups.add(group == null ? "" : group);
            }
            return new AggregateRow(rs.getLong(1), rs.getDouble(2), rs.getDouble(3), rs.getDouble(4), values,
                groups);
        };
    }

    private static String metricInputAlias(int index) {
        return "metric_input" + index;
    }

    private static String metricValueAlias(int index) {
        return "metric_value" + index;
    }
}
