package com.strata.domain;

/**
 * A listed object together with the cursor that points at it
 */
public class Edge<T> {
    private final String cursor;
    private final T node;

    public Edge(String cursor, T node) {
        this.cursor = cursor;
        this.node = node;
    }

    public String getCursor() {
        return cursor;
    }

    public T getNode() {
        return node;
    }
}
