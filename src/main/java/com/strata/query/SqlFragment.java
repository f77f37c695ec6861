package com.strata.query;

import java.util.ArrayList;
import java.util.List;

/**
 * A piece of SQL that can be embedded into another builder. Compiling appends
 * the SQL text with {@code ?} markers and the matching bound arguments in the
 * order they appear.
 */
public interface SqlFragment {

    void compileInto(StringBuilder sql, List<Object> args);

    default BuiltQuery build() {
        StringBuilder sql = new StringBuilder();
        List<Object> args = new ArrayList<>();
        compileInto(sql, args);
        return new BuiltQuery(sql.toString(), args);
    }
}
