package com.strata.query.filter;

import com.strata.query.InvalidQueryException;

import java.util.Arrays;
import java.util.List;

/**
 * Node of a filter tree. Boolean nodes carry children; comparison leaves carry
 * a key, an optional explicit column and at least one value.
 */
public class FilterOperation {
    private final FilterOperator operator;
    private final String key;
    private final String column;
    private final List<String> values;
    private final List<FilterOperation> filters;

    private FilterOperation(FilterOperator operator, String key, String column, List<String> values,
                            List<FilterOperation> filters) {
        this.operator = operator;
        this.key = key;
        this.column = column;
        this.values = List.copyOf(values);
        this.filters = List.copyOf(filters);
    }

    public static FilterOperation and(FilterOperation... children) {
        return new FilterOperation(FilterOperator.AND, null, null, List.of(), Arrays.asList(children));
    }

    public static FilterOperation or(FilterOperation... children) {
        return or(Arrays.asList(children));
    }

    public static FilterOperation or(List<FilterOperation> children) {
        return new FilterOperation(FilterOperator.OR, null, null, List.of(), children);
    }

    public static FilterOperation not(FilterOperation child) {
        return new FilterOperation(FilterOperator.NOT, null, null, List.of(), List.of(child));
    }

    public static FilterOperation compare(String key, FilterOperator operator, String... values) {
        return compare(key, null, operator, Arrays.asList(values));
    }

    /**
     * @param column explicit column overriding key resolution, may be null
     */
    public static FilterOperation compare(String key, String column, FilterOperator operator, List<String> values) {
        if (!operator.isComparison()) {
            throw new IllegalArgumentException("Not a comparison operator: " + operator);
        }
        if (values == null || values.isEmpty()) {
            throw new InvalidQueryException("Filter on " + key + " requires at least one value");
        }
        return new FilterOperation(operator, key, column, values, List.of());
    }

    public FilterOperator getOperator() {
        return operator;
    }

    public String getKey() {
        return key;
    }

    public String getColumn() {
        return column;
    }

    public List<String> getValues() {
        return values;
    }

    public List<FilterOperation> getFilters() {
        return filters;
    }

    @Override
    public String toString() {
        if (operator.isComparison()) {
            return key + " " + operator + " " + values;
        }
        return operator + filters.toString();
    }
}
