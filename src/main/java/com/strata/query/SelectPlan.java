package com.strata.query;

import com.strata.query.filter.FilterOperation;

import java.util.ArrayList;
import java.util.List;

/**
 * A scoped SELECT under construction, the parsed search filters it applies
 * and the attribute keys read so far
 */
public class SelectPlan {
    private final SelectBuilder builder;
    private final List<FilterOperation> filters;
    private final List<String> attributeFields;

    public SelectPlan(SelectBuilder builder, List<FilterOperation> filters, List<String> attributeFields) {
        this.builder = builder;
        this.filters = List.copyOf(filters);
        this.attributeFields = new ArrayList<>(attributeFields);
    }

    public SelectBuilder getBuilder() {
        return builder;
    }

    /**
     * Parsed search filters, for re-evaluation against fetched rows.
     */
    public List<FilterOperation> getFilters() {
        return filters;
    }

    public List<String> getAttributeFields() {
        return attributeFields;
    }

    public void addAttributeField(String field) {
        if (!attributeFields.contains(field)) {
            attributeFields.add(field);
        }
    }
}
