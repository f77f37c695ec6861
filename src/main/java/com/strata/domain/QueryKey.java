package com.strata.domain;

import java.util.Objects;

/**
 * A searchable key and its value type
 */
public class QueryKey {
    private final String name;
    private final KeyType type;

    public QueryKey(String name, KeyType type) {
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public KeyType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryKey)) return false;
        QueryKey other = (QueryKey) o;
        return Objects.equals(name, other.name) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + ":" + type;
    }
}
