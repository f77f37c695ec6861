package com.strata.domain;

/**
 * Sort direction for paged listings and cursor windows
 */
public enum SortDirection {
    ASC,
    DESC
}
