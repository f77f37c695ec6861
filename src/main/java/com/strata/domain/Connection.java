package com.strata.domain;

import java.util.List;

/**
 * One page of a keyset-paginated listing
 */
public class Connection<T> {
    private final List<Edge<T>> edges;
    private final PageInfo pageInfo;

    public Connection(List<Edge<T>> edges, PageInfo pageInfo) {
        this.edges = List.copyOf(edges);
        this.pageInfo = pageInfo;
    }

    public List<Edge<T>> getEdges() {
        return edges;
    }

    public PageInfo getPageInfo() {
        return pageInfo;
    }
}
