package com.strata.query.filter;

public enum FilterOperator {
    AND,
    OR,
    NOT,
    EQUAL,
    NOT_EQUAL,
    REGEXP,
    NOT_REGEXP;

    public boolean isComparison() {
        return this != AND && this != OR && this != NOT;
    }
}
