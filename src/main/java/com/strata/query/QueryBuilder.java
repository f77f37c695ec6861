package com.strata.query;

import com.strata.domain.DateRange;
import com.strata.domain.QueryInput;
import com.strata.domain.SortDirection;
import com.strata.domain.TableConfig;
import com.strata.query.filter.FilterOperation;
import com.strata.query.filter.FilterPredicateWriter;
import com.strata.query.filter.SearchQueryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds project and time scoped SELECT statements with keyset pagination
 * and search filters.
 *
 * Cursor predicates, for a cursor at timestamp T and id U:
 * <pre>
 *   after,  asc    T &lt;= Timestamp &lt;= end   AND (Timestamp &gt; T OR UUID &gt; U)   forward
 *   after,  desc   start &lt;= Timestamp &lt;= T AND (Timestamp &lt; T OR UUID &lt; U)   forward
 *   before, asc    start &lt;= Timestamp &lt;= T AND (Timestamp &lt; T OR UUID &lt; U)   backward
 *   before, desc   T &lt;= Timestamp &lt;= end   AND (Timestamp &gt; T OR UUID &gt; U)   backward
 *   at             Timestamp = T AND UUID = U                                   unordered
 *   none           start &lt;= Timestamp &lt;= end                                  forward
 * </pre>
 */
@Component
public class QueryBuilder {
    private static final Logger logger = LoggerFactory.getLogger(QueryBuilder.class);

    private final SearchQueryParser searchQueryParser;
    private final FilterPredicateWriter filterPredicateWriter;

    public QueryBuilder(SearchQueryParser searchQueryParser, FilterPredicateWriter filterPredicateWriter) {
        this.searchQueryParser = searchQueryParser;
        this.filterPredicateWriter = filterPredicateWriter;
    }

    /**
     * @throws InvalidQueryException on a malformed cursor or a missing date range
     */
    public SelectPlan buildSelect(TableConfig config, List<String> selectColumns, List<Integer> projectIds,
                                  QueryInput params, Pagination pagination) {
        DateRange dateRange = params.getDateRange();
        if (dateRange == null) {
            throw new InvalidQueryException("A date range is required");
        }
        if (!dateRange.isValid()) {
            throw new InvalidQueryException("Date range start must not be after its end: " + dateRange);
        }
        if (projectIds == null || projectIds.isEmpty()) {
            throw new InvalidQueryException("At least one project id is required");
        }

        SelectBuilder sb = new SelectBuilder();
        SortOrders orders = SortOrders.of(sb, pagination.getDirection(), config, params);

        if (selectColumns != null) {
            sb.select(selectColumns);
        }
        sb.from(config.getTableName());

        String projectIdColumn = config.getProjectIdColumn();
        if (projectIds.size() == 1) {
            sb.where(sb.equal(projectIdColumn, projectIds.get(0)));
        } else {
            sb.where(sb.in(projectIdColumn, projectIds));
        }

        boolean ascending = pagination.getDirection() == SortDirection.ASC;
        if (pagination.hasAfter()) {
            Cursor cursor = Cursor.decode(pagination.getAfter());
            if (ascending) {
                laterThan(sb, cursor, dateRange);
            } else {
                earlierThan(sb, cursor, dateRange);
            }
            sb.orderBy(orders.getForward());
        } else if (pagination.hasAt()) {
            Cursor cursor = Cursor.decode(pagination.getAt());
            sb.where(sb.equal("Timestamp", cursor.getTimestamp()))
                .where(sb.equal("UUID", cursor.getUuid()));
        } else if (pagination.hasBefore()) {
            Cursor cursor = Cursor.decode(pagination.getBefore());
            if (ascending) {
                earlierThan(sb, cursor, dateRange);
            } else {
                laterThan(sb, cursor, dateRange);
            }
            sb.orderBy(orders.getBackward());
        } else {
            sb.where(sb.lessEqualThan("Timestamp", dateRange.getEndDate()))
                .where(sb.greaterEqualThan("Timestamp", dateRange.getStartDate()));

            // Count queries do not select Timestamp, so they cannot be ordered by it
            if (!pagination.isCountOnly()) {
                sb.orderBy(orders.getForward());
            }
        }

        List<FilterOperation> filters = searchQueryParser.parse(params.getQuery(), config);
        List<String> attributeFields = filterPredicateWriter.write(sb, config, filters);
        logger.debug("Built select on {} with {} search filters", config.getTableName(), filters.size());

        return new SelectPlan(sb, filters, attributeFields);
    }

    // See https://dba.stackexchange.com/a/206811 for the row-value comparison rewrite
    private static void laterThan(SelectBuilder sb, Cursor cursor, DateRange dateRange) {
        sb.where(sb.greaterEqualThan("Timestamp", cursor.getTimestamp()))
            .where(sb.lessEqualThan("Timestamp", dateRange.getEndDate()))
            .where(sb.or(
                sb.greaterThan("Timestamp", cursor.getTimestamp()),
                sb.greaterThan("UUID", cursor.getUuid())));
    }

    private static void earlierThan(SelectBuilder sb, Cursor cursor, DateRange dateRange) {
        sb.where(sb.lessEqualThan("Timestamp", cursor.getTimestamp()))
            .where(sb.greaterEqualThan("Timestamp", dateRange.getStartDate()))
            .where(sb.or(
                sb.lessThan("Timestamp", cursor.getTimestamp()),
                sb.lessThan("UUID", cursor.getUuid())));
    }
}
