package com.strata.query;

import com.strata.domain.SortDirection;

/**
 * Keyset pagination state: at most one of after, before and at carries a
 * cursor. With none set the first page is read.
 */
public class Pagination {
    private String after;
    private String before;
    private String at;
    private SortDirection direction = SortDirection.DESC;
    private Integer limit;
    private boolean countOnly;

    public static Pagination firstPage() {
        return new Pagination();
    }

    public static Pagination after(String cursor) {
        Pagination pagination = new Pagination();
        pagination.after = cursor;
        return pagination;
    }

    public static Pagination before(String cursor) {
        Pagination pagination = new Pagination();
        pagination.before = cursor;
        return pagination;
    }

    public static Pagination at(String cursor) {
        Pagination pagination = new Pagination();
        pagination.at = cursor;
        return pagination;
    }

    /**
     * Unordered pagination for aggregate queries that do not select Timestamp.
     */
    public static Pagination countOnly() {
        Pagination pagination = new Pagination();
        pagination.countOnly = true;
        return pagination;
    }

    public Pagination withDirection(SortDirection direction) {
        this.direction = direction != null ? direction : SortDirection.DESC;
        return this;
    }

    public Pagination withLimit(Integer limit) {
        this.limit = limit;
        return this;
    }

    public String getAfter() {
        return after;
    }

    public String getBefore() {
        return before;
    }

    public String getAt() {
        return at;
    }

    public boolean hasAfter() {
        return isCursor(after);
    }

    public boolean hasBefore() {
        return isCursor(before);
    }

    public boolean hasAt() {
        return isCursor(at);
    }

    public SortDirection getDirection() {
        return direction;
    }

    public Integer getLimit() {
        return limit;
    }

    public boolean isCountOnly() {
        return countOnly;
    }

    // Single character cursors are treated as absent
    private static boolean isCursor(String cursor) {
        return cursor != null && cursor.length() > 1;
    }
}
