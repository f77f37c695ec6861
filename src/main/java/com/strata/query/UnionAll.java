package com.strata.query;

import java.util.Arrays;
import java.util.List;

/**
 * {@code (a) UNION ALL (b) ...} over nested select builders
 */
public class UnionAll implements SqlFragment {
    private final List<SqlFragment> selects;

    private UnionAll(List<SqlFragment> selects) {
        if (selects.isEmpty()) {
            throw new IllegalArgumentException("UNION ALL requires at least one select");
        }
        this.selects = List.copyOf(selects);
    }

    public static UnionAll of(SqlFragment... selects) {
        return new UnionAll(Arrays.asList(selects));
    }

    public static UnionAll of(List<? extends SqlFragment> selects) {
        return new UnionAll(List.copyOf(selects));
    }

    @Override
    public void compileInto(StringBuilder sql, List<Object> args) {
        for (int i = 0; i < selects.size(); i++) {
            if (i > 0) {
                sql.append(" UNION ALL ");
            }
            sql.append('(');
            selects.get(i).compileInto(sql, args);
            sql.append(')');
        }
    }
}
