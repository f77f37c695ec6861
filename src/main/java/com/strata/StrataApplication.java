package com.strata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Strata Query.
 *
 * Strata translates structured search queries and user authored SQL into
 * project scoped ClickHouse statements, and aggregates their results into
 * evenly sized metric buckets.
 *
 * Key Features:
 * - Keyset paginated reads over logs, traces, sessions, errors and events
 * - Search query filters with attribute column fallback
 * - Safe rewriting of user SQL onto physical resource tables
 * - Time or value bucketed metrics with top-N grouping and table sampling
 *
 * @author Strata Team
 * @version 1.0.0
 */
@SpringBootApplication
public class StrataApplication {

    /**
     * Main entry point for the Strata query service.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(StrataApplication.class, args);
    }
}
