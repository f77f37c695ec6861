package com.strata.storage;

import com.strata.domain.SampleableTableConfig;
import com.strata.domain.TableConfig;

import java.util.Collection;
import java.util.Optional;

/**
 * Resolves logical resource names to table configurations
 */
public interface TableConfigRegistry {

    Optional<TableConfig> find(String resource);

    /**
     * @throws com.strata.query.InvalidQueryException if the resource is unknown
     */
    TableConfig get(String resource);

    /**
     * Pairs the resource with its sampling companion, or with itself when it has none.
     */
    SampleableTableConfig sampleable(String resource, long sampleSizeRows);

    Collection<TableConfig> all();
}
