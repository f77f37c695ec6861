package com.strata.query.objects;

import com.strata.domain.Connection;
import com.strata.domain.Edge;
import com.strata.domain.PageInfo;
import com.strata.domain.QueryInput;
import com.strata.domain.TableConfig;
import com.strata.query.AttributeScope;
import com.strata.query.BuiltQuery;
import com.strata.query.Pagination;
import com.strata.query.QueryBuilder;
import com.strata.query.QueryLimits;
import com.strata.query.SelectBuilder;
import com.strata.query.SelectPlan;
import com.strata.query.SortOrders;
import com.strata.query.UnionAll;
import com.strata.storage.StoreClient;
import com.strata.storage.StoreContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Paged object listings over a resource table.
 *
 * The inner query selects only {@code (Timestamp, UUID)} pairs for the
 * requested window; the outer query fetches full rows for those pairs and
 * reads one row past the limit to detect a further page.
 */
@Service
public class ObjectReader {
    private static final Logger log = LoggerFactory.getLogger(ObjectReader.class);

    private static final List<String> INNER_SELECT = List.of("Timestamp", "UUID");

    private final StoreClient storeClient;
    private final QueryBuilder queryBuilder;
    private final QueryLimits limits;

    public ObjectReader(StoreClient storeClient, QueryBuilder queryBuilder, QueryLimits limits) {
        this.storeClient = storeClient;
        this.queryBuilder = queryBuilder;
        this.limits = limits;
    }

    public <T> Connection<T> readObjects(StoreContext context, TableConfig config, TableConfig samplingConfig,
                                        int projectId, QueryInput params, Pagination pagination,
                                        RowMapper<Edge<T>> edgeMapper) {
        BuiltQuery query = buildReadQuery(config, samplingConfig, projectId, params, pagination);
        List<Edge<T>> edges = storeClient.query(context, config.getTableName(), query, edgeMapper);
        log.debug("Read {} edges from {}", edges.size(), config.getTableName());
        return getConnection(edges, pagination, limitOf(pagination));
    }

    BuiltQuery buildReadQuery(TableConfig config, TableConfig samplingConfig, int projectId, QueryInput params,
                              Pagination pagination) {
        int limit = limitOf(pagination);
        TableConfig innerConfig = useSamplingTable(params) && samplingConfig != null ? samplingConfig : config;

        SelectBuilder sb = new SelectBuilder();
        String orderForward = SortOrders.of(sb, pagination.getDirection(), config, params).getForward();
        String pairs = "(" + String.join(",", INNER_SELECT) + ")";

        sb.select(config.getSelectColumns())
            .distinct()
            .from(config.getTableName())
            .where(sb.equal(config.getProjectIdColumn(), projectId));

        if (pagination.hasAt()) {
            // A window centred on the cursor row
            SelectBuilder beforeSb = inner(innerConfig, projectId, params,
                Pagination.before(pagination.getAt()).withDirection(pagination.getDirection()));
            beforeSb.distinct().limit(limit / 2 + 1);

            SelectBuilder atSb = inner(innerConfig, projectId, params,
                Pagination.at(pagination.getAt()).withDirection(pagination.getDirection()));
            atSb.distinct();

            SelectBuilder afterSb = inner(innerConfig, projectId, params,
                Pagination.after(pagination.getAt()).withDirection(pagination.getDirection()));
            afterSb.distinct().limit(limit / 2 + 1);

            sb.where(sb.in(pairs, UnionAll.of(beforeSb, atSb, afterSb)))
                .orderBy(orderForward);
        } else {
            SelectBuilder fromSb = inner(innerConfig, projectId, params, pagination);
            fromSb.distinct().limit(limit + 1);

            sb.where(sb.in(pairs, fromSb))
                .orderBy(orderForward)
                .limit(limit + 1);
        }
        return sb.build();
    }

    private SelectBuilder inner(TableConfig config, int projectId, QueryInput params, Pagination pagination) {
        SelectPlan plan = queryBuilder.buildSelect(config, INNER_SELECT, List.of(projectId), params, pagination);
        AttributeScope.apply(plan.getBuilder(), config, plan.getAttributeFields(), List.of(projectId),
            params.getDateRange());
        return plan.getBuilder();
    }

    private int limitOf(Pagination pagination) {
        return pagination.getLimit() != null ? pagination.getLimit() : limits.getDefaultPageSize();
    }

    /**
     * Trims the limit+1 lookahead row and derives page info from it.
     */
    static <T> Connection<T> getConnection(List<Edge<T>> fetched, Pagination pagination, int limit) {
        List<Edge<T>> edges = new ArrayList<>(fetched);
        boolean hasNextPage = false;
        boolean hasPreviousPage = false;

        if (pagination.hasAt()) {
            int half = limit / 2;
            int idx = indexOf(edges, pagination.getAt());
            if (idx > half) {
                int drop = idx - half;
                edges = new ArrayList<>(edges.subList(drop, edges.size()));
                idx -= drop;
                hasPreviousPage = true;
            }
            if (idx >= 0 && edges.size() - idx - 1 > half) {
                edges = new ArrayList<>(edges.subList(0, idx + half + 1));
                hasNextPage = true;
            }
        } else if (pagination.hasBefore()) {
            if (edges.size() == limit + 1) {
                hasPreviousPage = true;
                edges.remove(0);
            }
            hasNextPage = true;
        } else if (pagination.hasAfter()) {
            hasPreviousPage = true;
            if (edges.size() == limit + 1) {
                hasNextPage = true;
                edges = new ArrayList<>(edges.subList(0, limit));
            }
        } else if (edges.size() == limit + 1) {
            hasNextPage = true;
            edges = new ArrayList<>(edges.subList(0, limit));
        }

        String startCursor = edges.isEmpty() ? "" : edges.get(0).getCursor();
        String endCursor = edges.isEmpty() ? "" : edges.get(edges.size() - 1).getCursor();
        return new Connection<>(edges, new PageInfo(hasNextPage, hasPreviousPage, startCursor, endCursor));
    }

    private static <T> int indexOf(List<Edge<T>> edges, String cursor) {
        for (int i = 0; i < edges.size(); i++) {
            if (cursor.equals(edges.get(i).getCursor())) {
                return i;
            }
        }
        return -1;
    }

    // A non-default sort column reads the sampling table
    private static boolean useSamplingTable(QueryInput params) {
        return params.getSort() != null && !"timestamp".equalsIgnoreCase(params.getSort().getColumn());
    }
}
