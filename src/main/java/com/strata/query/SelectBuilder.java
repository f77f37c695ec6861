package com.strata.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mutable builder for ClickHouse SELECT statements.
 *
 * Values are never inlined: {@link #var(Object)} registers a value and returns
 * a {@code ${n}} placeholder that is rewritten to {@code ?} at build time, in
 * order of appearance, so clauses can be assembled in any order. A nested
 * {@link SqlFragment} registered as a value is compiled in place together with
 * its own arguments.
 */
public class SelectBuilder implements SqlFragment {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{(\\d+)}");

    private final List<Object> vars = new ArrayList<>();
    private final List<String> selectColumns = new ArrayList<>();
    private final List<String> joins = new ArrayList<>();
    private final List<String> whereExprs = new ArrayList<>();
    private final List<String> groupByColumns = new ArrayList<>();
    private final List<String> orderByColumns = new ArrayList<>();
    private boolean distinct;
    private String table;
    private Integer limit;

    public SelectBuilder select(String... columns) {
        return select(Arrays.asList(columns));
    }

    /**
     * Replaces the select list.
     */
    public SelectBuilder select(Collection<String> columns) {
        selectColumns.clear();
        selectColumns.addAll(columns);
        return this;
    }

    public SelectBuilder distinct() {
        this.distinct = true;
        return this;
    }

    public SelectBuilder from(String table) {
        this.table = table;
        return this;
    }

    public SelectBuilder from(SqlFragment subquery, String alias) {
        this.table = "(" + var(subquery) + ") AS " + alias;
        return this;
    }

    public SelectBuilder join(String joinClause) {
        joins.add(joinClause);
        return this;
    }

    public SelectBuilder where(String... exprs) {
        whereExprs.addAll(Arrays.asList(exprs));
        return this;
    }

    public SelectBuilder groupBy(String... columns) {
        groupByColumns.addAll(Arrays.asList(columns));
        return this;
    }

    public SelectBuilder groupBy(Collection<String> columns) {
        groupByColumns.addAll(columns);
        return this;
    }

    public SelectBuilder orderBy(String... columns) {
        orderByColumns.addAll(Arrays.asList(columns));
        return this;
    }

    public SelectBuilder orderBy(Collection<String> columns) {
        orderByColumns.addAll(columns);
        return this;
    }

    public SelectBuilder limit(int limit) {
        this.limit = limit;
        return this;
    }

    public String getTable() {
        return table;
    }

    public List<String> getSelectColumns() {
        return List.copyOf(selectColumns);
    }

    // Expression helpers

    public String var(Object value) {
        vars.add(value);
        return "${" + (vars.size() - 1) + "}";
    }

    public String equal(String field, Object value) {
        return field + " = " + var(value);
    }

    public String notEqual(String field, Object value) {
        return field + " != " + var(value);
    }

    public String greaterThan(String field, Object value) {
        return field + " > " + var(value);
    }

    public String greaterEqualThan(String field, Object value) {
        return field + " >= " + var(value);
    }

    public String lessThan(String field, Object value) {
        return field + " < " + var(value);
    }

    public String lessEqualThan(String field, Object value) {
        return field + " <= " + var(value);
    }

    public String in(String field, Collection<?> values) {
        if (values.isEmpty()) {
            return "0 = 1";
        }
        List<String> placeholders = new ArrayList<>(values.size());
        for (Object value : values) {
            placeholders.add(var(value));
        }
        return field + " IN (" + String.join(", ", placeholders) + ")";
    }

    public String in(String field, SqlFragment subquery) {
        return field + " IN (" + var(subquery) + ")";
    }

    public String or(String... exprs) {
        return "(" + String.join(" OR ", exprs) + ")";
    }

    public String or(Collection<String> exprs) {
        return or(exprs.toArray(new String[0]));
    }

    public String and(String... exprs) {
        return "(" + String.join(" AND ", exprs) + ")";
    }

    public String as(String expr, String alias) {
        return expr + " AS " + alias;
    }

    @Override
    public void compileInto(StringBuilder sql, List<Object> args) {
        StringBuilder template = new StringBuilder("SELECT ");
        if (distinct) {
            template.append("DISTINCT ");
        }
        template.append(selectColumns.isEmpty() ? "*" : String.join(", ", selectColumns));
        if (table != null) {
            template.append(" FROM ").append(table);
        }
        for (String join : joins) {
            template.append(' ').append(join);
        }
        if (!whereExprs.isEmpty()) {
            template.append(" WHERE ").append(String.join(" AND ", whereExprs));
        }
        if (!groupByColumns.isEmpty()) {
            template.append(" GROUP BY ").append(String.join(", ", groupByColumns));
        }
        if (!orderByColumns.isEmpty()) {
            template.append(" ORDER BY ").append(String.join(", ", orderByColumns));
        }
        if (limit != null) {
            template.append(" LIMIT ").append(limit);
        }
        expand(template, sql, args);
    }

    private void expand(CharSequence template, StringBuilder sql, List<Object> args) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        int last = 0;
        while (matcher.find()) {
            sql.append(template, last, matcher.start());
            Object value = vars.get(Integer.parseInt(matcher.group(1)));
            if (value instanceof SqlFragment) {
                ((SqlFragment) value).compileInto(sql, args);
            } else {
                sql.append('?');
                args.add(value);
            }
            last = matcher.end();
        }
        sql.append(template, last, template.length());
    }

    @Override
    public String toString() {
        return build().getSql();
    }
}
