package com.strata.query.rewrite;

import java.util.Set;

/**
 * Logical table names that user SQL may query and that are always rewritten
 * with project and time scoping
 */
public final class ResourceTables {

    public static final Set<String> NAMES = Set.of("sessions", "errors", "logs", "traces", "events", "metrics");

    private ResourceTables() {
    }

    public static boolean isResource(String table) {
        return table != null && NAMES.contains(table);
    }
}
