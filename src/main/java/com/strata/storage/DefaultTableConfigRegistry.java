package com.strata.storage;

import com.strata.domain.SampleableTableConfig;
import com.strata.domain.TableConfig;
import com.strata.query.InvalidQueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in table layout for the six resource tables and their sampling
 * companions
 */
@Component
public class DefaultTableConfigRegistry implements TableConfigRegistry {
    private static final Logger logger = LoggerFactory.getLogger(DefaultTableConfigRegistry.class);

    public static final String LOGS = "logs";
    public static final String TRACES = "traces";
    public static final String SESSIONS = "sessions";
    public static final String ERRORS = "errors";
    public static final String EVENTS = "events";
    public static final String METRICS = "metrics";

    private final Map<String, TableConfig> configs = new LinkedHashMap<>();
    private final Map<String, TableConfig> samplingConfigs = new LinkedHashMap<>();

    public DefaultTableConfigRegistry() {
        TableConfig logs = TableConfig.builder(LOGS)
            .tableName("logs")
            .key("timestamp", "Timestamp")
            .key("level", "SeverityText")
            .key("message", "Body")
            .key("secure_session_id", "SecureSessionId")
            .key("span_id", "SpanId")
            .key("trace_id", "TraceId")
            .key("source", "Source")
            .key("service_name", "ServiceName")
            .key("service_version", "ServiceVersion")
            .key("environment", "Environment")
            .attributesColumn("", "LogAttributes")
            .bodyColumn("Body")
            .severityColumn("SeverityText")
            .selectColumns(List.of("Timestamp", "UUID", "SeverityText", "Body", "LogAttributes", "TraceId", "SpanId",
                "SecureSessionId", "Source", "ServiceName", "ServiceVersion", "Environment"))
            .build();
        register(logs, logs.toBuilder().tableName("logs_sampling").sampled(true).build());

        TableConfig traces = TableConfig.builder(TRACES)
            .tableName("traces")
            .key("timestamp", "Timestamp")
            .key("trace_id", "TraceId")
            .key("span_id", "SpanId")
            .key("parent_span_id", "ParentSpanId")
            .key("span_name", "SpanName")
            .key("span_kind", "SpanKind")
            .key("duration", "Duration")
            .key("has_errors", "HasErrors")
            .key("secure_session_id", "SecureSessionId")
            .key("service_name", "ServiceName")
            .key("service_version", "ServiceVersion")
            .key("environment", "Environment")
            .key("status_code", "StatusCode")
            .attributesColumn("process.", "ProcessAttributes")
            .attributesColumn("", "TraceAttributes")
            .bodyColumn("SpanName")
            .selectColumns(List.of("Timestamp", "UUID", "TraceId", "SpanId", "ParentSpanId", "SpanName", "SpanKind",
                "Duration", "ServiceName", "ServiceVersion", "Environment", "HasErrors", "TraceAttributes"))
            .build();
        register(traces, traces.toBuilder().tableName("traces_sampling").sampled(true).build());

        TableConfig sessions = TableConfig.builder(SESSIONS)
            .tableName("sessions_joined_vw")
            .projectIdColumn(TableConfig.LEGACY_PROJECT_ID)
            .key("timestamp", "Timestamp")
            .key("secure_id", "SecureID")
            .key("identifier", "Identifier")
            .key("city", "City")
            .key("country", "Country")
            .key("os_name", "OSName")
            .key("browser_name", "BrowserName")
            .key("environment", "Environment")
            .key("app_version", "AppVersion")
            .key("active_length", "ActiveLength")
            .key("length", "Length")
            .key("pages_visited", "PagesVisited")
            .key("has_errors", "HasErrors")
            .key("has_rage_clicks", "HasRageClicks")
            .key("first_time", "FirstTime")
            .key("viewed", "Viewed")
            .attributesColumn("", "Fields")
            .attributesTable("session_fields")
            .defaultFilter("Excluded = false")
            .selectColumns(List.of("Timestamp", "UUID", "SecureID", "Identifier", "City", "Country", "OSName",
                "BrowserName", "Environment", "ActiveLength", "Length", "HasErrors"))
            .build();
        register(sessions, null);

        TableConfig errors = TableConfig.builder(ERRORS)
            .tableName("errors_joined_vw")
            .projectIdColumn(TableConfig.LEGACY_PROJECT_ID)
            .key("timestamp", "Timestamp")
            .key("event", "Event")
            .key("type", "Type")
            .key("url", "URL")
            .key("status", "Status")
            .key("browser", "Browser")
            .key("os", "OS")
            .key("environment", "Environment")
            .key("service_name", "ServiceName")
            .key("service_version", "ServiceVersion")
            .key("secure_session_id", "SecureSessionId")
            .key("trace_id", "TraceId")
            .key("span_id", "SpanId")
            .attributesColumn("", "ErrorAttributes")
            .bodyColumn("Event")
            .selectColumns(List.of("Timestamp", "UUID", "Event", "Type", "URL", "Status", "Browser", "OS",
                "Environment", "ServiceName", "SecureSessionId", "TraceId"))
            .build();
        register(errors, null);

        TableConfig events = TableConfig.builder(EVENTS)
            .tableName("events")
            .key("timestamp", "Timestamp")
            .key("event", "Event")
            .key("secure_session_id", "SessionSecureID")
            .key("session_id", "SessionID")
            .key("identifier", "Identifier")
            .key("browser_name", "BrowserName")
            .key("os_name", "OSName")
            .key("city", "City")
            .key("country", "Country")
            .key("environment", "Environment")
            .key("service_name", "ServiceName")
            .attributesColumn("", "Attributes")
            .selectColumns(List.of("Timestamp", "UUID", "Event", "SessionSecureID", "Identifier", "Attributes"))
            .build();
        register(events, events.toBuilder().tableName("events_sampling").sampled(true).build());

        TableConfig metrics = TableConfig.builder(METRICS)
            .tableName("metrics")
            .key("timestamp", "Timestamp")
            .key("metric_name", "MetricName")
            .key("metric_type", "MetricType")
            .key("service_name", "ServiceName")
            .key("trace_id", "TraceId")
            .key("span_id", "SpanId")
            .attributesColumn("", "Attributes")
            .metricColumn("Value")
            .selectColumns(List.of("Timestamp", "UUID", "MetricName", "MetricType", "Value", "ServiceName",
                "Attributes"))
            .build();
        register(metrics, null);

        logger.info("Registered table configurations for resources {}", configs.keySet());
    }

    private void register(TableConfig config, TableConfig samplingConfig) {
        configs.put(config.getResource(), config);
        if (samplingConfig != null) {
            samplingConfigs.put(config.getResource(), samplingConfig);
        }
    }

    @Override
    public Optional<TableConfig> find(String resource) {
        return Optional.ofNullable(configs.get(resource));
    }

    @Override
    public TableConfig get(String resource) {
        return find(resource)
            .orElseThrow(() -> new InvalidQueryException("Unknown resource table: " + resource));
    }

    @Override
    public SampleableTableConfig sampleable(String resource, long sampleSizeRows) {
        TableConfig config = get(resource);
        TableConfig samplingConfig = samplingConfigs.get(resource);
        if (samplingConfig == null) {
            return SampleableTableConfig.unsampled(config);
        }
        return new SampleableTableConfig(config, samplingConfig, sampleSizeRows);
    }

    @Override
    public Collection<TableConfig> all() {
        return Collections.unmodifiableCollection(configs.values());
    }
}
