package com.strata.storage;

import com.strata.query.BuiltQuery;
import com.strata.query.QueryCancelledException;
import com.strata.query.QueryExecutionException;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;

import java.sql.PreparedStatement;
import java.sql.ResultSetMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * {@link StoreClient} over a Spring {@link JdbcTemplate}.
 *
 * Context settings are appended to the statement as a trailing
 * {@code SETTINGS} clause. The prepared statement is registered with the
 * context while it runs so that cancelling the request aborts it.
 */
public class JdbcStoreClient implements StoreClient {
    private static final Logger log = LoggerFactory.getLogger(JdbcStoreClient.class);

    private final JdbcTemplate jdbcTemplate;
    private final StoreMetrics storeMetrics;

    public JdbcStoreClient(JdbcTemplate jdbcTemplate, StoreMetrics storeMetrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.storeMetrics = storeMetrics;
    }

    @Override
    public <T> List<T> query(StoreContext context, String table, BuiltQuery query, RowMapper<T> rowMapper) {
        String sql = withSettings(query.getSql(), context.getSettings());
        return execute(context, table, "SELECT", sql, query.getArgs(),
            creator -> jdbcTemplate.query(creator, rowMapper));
    }

    @Override
    public ResultRows queryRows(StoreContext context, String table, BuiltQuery query) {
        String sql = withSettings(query.getSql(), context.getSettings());
        ResultSetExtractor<ResultRows> extractor = rs -> {
            ResultSetMetaData metaData = rs.getMetaData();
            List<ResultColumn> columns = new ArrayList<>();
            for (int i = 1; i <= metaData.getColumnCount(); i++) {
                columns.add(new ResultColumn(metaData.getColumnLabel(i), metaData.getColumnTypeName(i)));
            }
            List<List<Object>> rows = new ArrayList<>();
            while (rs.next()) {
                List<Object> row = new ArrayList<>(columns.size());
                for (int i = 1; i <= columns.size(); i++) {
                    row.add(rs.getObject(i));
                }
                rows.add(row);
            }
            return new ResultRows(columns, rows);
        };
        return execute(context, table, "SELECT", sql, query.getArgs(),
            creator -> jdbcTemplate.query(creator, extractor));
    }

    @Override
    public void exec(StoreContext context, String table, BuiltQuery statement) {
        String sql = withSettings(statement.getSql(), context.getSettings());
        execute(context, table, "INSERT", sql, statement.getArgs(), creator -> jdbcTemplate.update(creator));
    }

    private <R> R execute(StoreContext context, String table, String operation, String sql, List<Object> args,
                          Function<PreparedStatementCreator, R> call) {
        if (context.isCancelled()) {
            storeMetrics.recordCancelled();
            throw new QueryCancelledException(table);
        }

        Object[] bound = bindArgs(args);
        log.debug("Executing {} on {}: {} {}", operation, table, sql, args);

        List<PreparedStatement> opened = new ArrayList<>(1);
        PreparedStatementCreator creator = con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            opened.add(ps);
            context.register(ps);
            new ArgumentPreparedStatementSetter(bound).setValues(ps);
            return ps;
        };

        Timer.Sample sample = storeMetrics.start();
        try {
            R result = call.apply(creator);
            storeMetrics.record(sample, table, operation, "success");
            return result;
        } catch (DataAccessException e) {
            if (context.isCancelled()) {
                storeMetrics.record(sample, table, operation, "cancelled");
                storeMetrics.recordCancelled();
                throw new QueryCancelledException(table, sql, e);
            }
            storeMetrics.record(sample, table, operation, "failure");
            storeMetrics.recordFailure();
            log.error("Store {} failed on table {}: {}", operation, table, sql, e);
            throw new QueryExecutionException("Store " + operation + " failed", table, sql, e);
        } finally {
            for (PreparedStatement ps : opened) {
                context.unregister(ps);
            }
        }
    }

    /**
     * Appends {@code SETTINGS k = v, ...} on a line of its own, so that a
     * trailing line comment cannot hide it. Trailing semicolons are dropped.
     * String values are quoted.
     */
    static String withSettings(String sql, Map<String, Object> settings) {
        if (settings.isEmpty()) {
            return sql;
        }
        int end = sql.length();
        while (end > 0 && (Character.isWhitespace(sql.charAt(end - 1)) || sql.charAt(end - 1) == ';')) {
            end--;
        }
        StringBuilder sb = new StringBuilder(sql.substring(0, end)).append("\nSETTINGS ");
        boolean first = true;
        for (Map.Entry<String, Object> setting : settings.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(setting.getKey()).append(" = ");
            Object value = setting.getValue();
            if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append('\'').append(String.valueOf(value).replace("\\", "\\\\").replace("'", "\\'")).append('\'');
            }
        }
        return sb.toString();
    }

    private static Object[] bindArgs(List<Object> args) {
        Object[] bound = new Object[args.size()];
        for (int i = 0; i < args.size(); i++) {
            Object arg = args.get(i);
            bound[i] = arg instanceof Instant ? Timestamp.from((Instant) arg) : arg;
        }
        return bound;
    }
}
