package com.strata.query.filter;

import java.util.Optional;

/**
 * A row value whose sub-fields can be addressed with dotted filter keys
 */
public interface NestedFields {

    Optional<Object> field(String name);
}
