package com.strata.domain;

/**
 * Requested sort column and direction
 */
public class SortInput {
    private final String column;
    private final SortDirection direction;

    public SortInput(String column, SortDirection direction) {
        this.column = column;
        this.direction = direction;
    }

    public String getColumn() {
        return column;
    }

    public SortDirection getDirection() {
        return direction;
    }
}
