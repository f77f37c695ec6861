package com.strata.query;

import com.strata.domain.DateRange;
import com.strata.domain.TableConfig;

import java.util.Collection;
import java.util.List;

/**
 * Final scoping of a builder-based query: the configuration's default filter
 * and, for configurations with a separate attributes table, a join pulling
 * in the attribute keys the query reads.
 */
public final class AttributeScope {

    public static final String ATTRIBUTES_ALIAS = "attributes";

    private AttributeScope() {
    }

    public static void apply(SelectBuilder sb, TableConfig config, Collection<String> fields,
                             List<Integer> projectIds, DateRange dateRange) {
        String defaultFilter = config.getDefaultFilter();
        if (defaultFilter != null && !defaultFilter.isEmpty()) {
            sb.where("(" + defaultFilter + ")");
        }

        if (!config.hasAttributesTable() || fields.isEmpty()) {
            return;
        }

        SelectBuilder attributes = new SelectBuilder();
        attributes.select("UUID", "groupArray((Key, Value)) AS " + config.getAttributesColumn(""))
            .from(config.getAttributesTable())
            .where(projectIds.size() == 1
                ? attributes.equal(config.getProjectIdColumn(), projectIds.get(0))
                : attributes.in(config.getProjectIdColumn(), projectIds))
            .where(attributes.greaterEqualThan("Timestamp", dateRange.getStartDate()))
            .where(attributes.lessEqualThan("Timestamp", dateRange.getEndDate()))
            .where(attributes.in("Key", List.copyOf(fields)))
            .groupBy("UUID");

        sb.join("LEFT JOIN (" + sb.var(attributes) + ") AS " + ATTRIBUTES_ALIAS + " USING (UUID)");
    }
}
