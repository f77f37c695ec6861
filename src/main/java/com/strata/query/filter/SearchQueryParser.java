package com.strata.query.filter;

import com.strata.domain.TableConfig;

import java.util.List;

/**
 * Turns a free-form search string into a filter tree. Top level filters are
 * implicitly ANDed; an empty query yields an empty list.
 */
public interface SearchQueryParser {

    List<FilterOperation> parse(String query, TableConfig config);
}
