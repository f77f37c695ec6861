package com.strata.domain;

/**
 * Routes attribute keys starting with {@code prefix} to an attribute column.
 * An empty prefix matches every key.
 */
public class ColumnMapping {
    private final String prefix;
    private final String column;

    public ColumnMapping(String prefix, String column) {
        this.prefix = prefix == null ? "" : prefix;
        this.column = column;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getColumn() {
        return column;
    }

    public boolean matches(String key) {
        return key != null && key.startsWith(prefix);
    }
}
