package com.strata.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes one logical resource table: its physical name, the first-class
 * columns, the attribute columns holding open-ended key/value pairs, and the
 * optional body, severity, metric and default filter settings.
 *
 * Instances are immutable; derive variants with {@link #toBuilder()}.
 */
public class TableConfig {
    public static final String PROJECT_ID = "ProjectId";
    public static final String LEGACY_PROJECT_ID = "ProjectID";

    private final String resource;
    private final String tableName;
    private final Map<String, String> keysToColumns;
    private final List<ColumnMapping> attributesColumns;
    private final String attributesTable;
    private final String bodyColumn;
    private final String severityColumn;
    private final List<String> selectColumns;
    private final String defaultFilter;
    private final String metricColumn;
    private final boolean sampled;
    private final String projectIdColumn;

    private TableConfig(Builder builder) {
        this.resource = builder.resource;
        this.tableName = builder.tableName;
        this.keysToColumns = Collections.unmodifiableMap(new LinkedHashMap<>(builder.keysToColumns));
        this.attributesColumns = List.copyOf(builder.attributesColumns);
        this.attributesTable = builder.attributesTable;
        this.bodyColumn = builder.bodyColumn;
        this.severityColumn = builder.severityColumn;
        this.selectColumns = List.copyOf(builder.selectColumns);
        this.defaultFilter = builder.defaultFilter;
        this.metricColumn = builder.metricColumn;
        this.sampled = builder.sampled;
        this.projectIdColumn = builder.projectIdColumn;
    }

    public static Builder builder(String resource) {
        return new Builder(resource);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(resource)
            .tableName(tableName)
            .attributesTable(attributesTable)
            .bodyColumn(bodyColumn)
            .severityColumn(severityColumn)
            .defaultFilter(defaultFilter)
            .metricColumn(metricColumn)
            .sampled(sampled)
            .projectIdColumn(projectIdColumn);
        builder.keysToColumns.putAll(keysToColumns);
        builder.attributesColumns.addAll(attributesColumns);
        builder.selectColumns.addAll(selectColumns);
        return builder;
    }

    /**
     * Logical resource name, e.g. {@code logs}.
     */
    public String getResource() {
        return resource;
    }

    /**
     * Physical table expression used in FROM clauses.
     */
    public String getTableName() {
        return tableName;
    }

    public Map<String, String> getKeysToColumns() {
        return keysToColumns;
    }

    public List<ColumnMapping> getAttributesColumns() {
        return attributesColumns;
    }

    public String getAttributesTable() {
        return attributesTable;
    }

    public boolean hasAttributesTable() {
        return attributesTable != null && !attributesTable.isEmpty();
    }

    public String getBodyColumn() {
        return bodyColumn;
    }

    public String getSeverityColumn() {
        return severityColumn;
    }

    public List<String> getSelectColumns() {
        return selectColumns;
    }

    public String getDefaultFilter() {
        return defaultFilter;
    }

    public String getMetricColumn() {
        return metricColumn;
    }

    /**
     * Whether rows carry a {@code _sample_factor} that counts and sums must be scaled by.
     */
    public boolean isSampled() {
        return sampled;
    }

    public String getProjectIdColumn() {
        return projectIdColumn;
    }

    /**
     * Resolves the attribute column holding {@code key}: the first mapping whose
     * prefix matches wins.
     */
    public String getAttributesColumn(String key) {
        for (ColumnMapping mapping : attributesColumns) {
            if (mapping.matches(key)) {
                return mapping.getColumn();
            }
        }
        return attributesColumns.isEmpty() ? "" : attributesColumns.get(0).getColumn();
    }

    public boolean isAttributesColumn(String column) {
        for (ColumnMapping mapping : attributesColumns) {
            if (mapping.getColumn().equals(column)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "TableConfig{" + resource + " -> " + tableName + (sampled ? " (sampled)" : "") + "}";
    }

    public static class Builder {
        private final String resource;
        private String tableName;
        private final Map<String, String> keysToColumns = new LinkedHashMap<>();
        private final List<ColumnMapping> attributesColumns = new ArrayList<>();
        private String attributesTable;
        private String bodyColumn;
        private String severityColumn;
        private final List<String> selectColumns = new ArrayList<>();
        private String defaultFilter;
        private String metricColumn;
        private boolean sampled;
        private String projectIdColumn = PROJECT_ID;

        private Builder(String resource) {
            this.resource = resource;
            this.tableName = resource;
        }

        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        public Builder key(String key, String column) {
            keysToColumns.put(key, column);
            return this;
        }

        public Builder keys(Map<String, String> keys) {
            keysToColumns.putAll(keys);
            return this;
        }

        public Builder attributesColumn(String prefix, String column) {
            attributesColumns.add(new ColumnMapping(prefix, column));
            return this;
        }

        public Builder attributesTable(String attributesTable) {
            this.attributesTable = attributesTable;
            return this;
        }

        public Builder bodyColumn(String bodyColumn) {
            this.bodyColumn = bodyColumn;
            return this;
        }

        public Builder severityColumn(String severityColumn) {
            this.severityColumn = severityColumn;
            return this;
        }

        public Builder selectColumns(List<String> columns) {
            selectColumns.clear();
            selectColumns.addAll(columns);
            return this;
        }

        public Builder defaultFilter(String defaultFilter) {
            this.defaultFilter = defaultFilter;
            return this;
        }

        public Builder metricColumn(String metricColumn) {
            this.metricColumn = metricColumn;
            return this;
        }

        public Builder sampled(boolean sampled) {
            this.sampled = sampled;
            return this;
        }

        public Builder projectIdColumn(String projectIdColumn) {
            this.projectIdColumn = projectIdColumn;
            return this;
        }

        public TableConfig build() {
            if (tableName == null || tableName.isEmpty()) {
                throw new IllegalStateException("Table name is required for resource " + resource);
            }
            return new TableConfig(this);
        }
    }
}
