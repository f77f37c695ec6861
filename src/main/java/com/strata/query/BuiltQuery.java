package com.strata.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compiled SQL text with positional arguments
 */
public class BuiltQuery {
    private final String sql;
    private final List<Object> args;

    public BuiltQuery(String sql, List<Object> args) {
        this.sql = sql;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static BuiltQuery raw(String sql) {
        return new BuiltQuery(sql, List.of());
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getArgs() {
        return args;
    }

    public BuiltQuery withPrefix(String prefix) {
        return new BuiltQuery(prefix + sql, args);
    }

    @Override
    public String toString() {
        return sql + " " + args;
    }
}
