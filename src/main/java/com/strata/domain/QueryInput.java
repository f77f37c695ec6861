package com.strata.domain;

/**
 * Caller supplied query parameters: the date range, an optional sort and an
 * optional free-form search query.
 */
public class QueryInput {
    private String query;
    private DateRange dateRange;
    private SortInput sort;

    public QueryInput() {
    }

    public QueryInput(String query, DateRange dateRange) {
        this.query = query;
        this.dateRange = dateRange;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public DateRange getDateRange() {
        return dateRange;
    }

    public void setDateRange(DateRange dateRange) {
        this.dateRange = dateRange;
    }

    public SortInput getSort() {
        return sort;
    }

    public void setSort(SortInput sort) {
        this.sort = sort;
    }
}
