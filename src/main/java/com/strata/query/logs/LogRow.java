package com.strata.query.logs;

import com.strata.domain.Edge;
import com.strata.query.Cursor;
import com.strata.query.filter.FieldRegistry;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the logs table
 */
public class LogRow {

    /** Fields addressable by in-memory filters, keyed by physical column. */
    public static final FieldRegistry<LogRow> FIELDS = new FieldRegistry<LogRow>()
        .field("Timestamp", LogRow::getTimestamp)
        .field("UUID", LogRow::getUuid)
        .field("SeverityText", LogRow::getSeverityText)
        .field("Body", LogRow::getBody)
        .field("TraceId", LogRow::getTraceId)
        .field("SpanId", LogRow::getSpanId)
        .field("SecureSessionId", LogRow::getSecureSessionId)
        .field("Source", LogRow::getSource)
        .field("ServiceName", LogRow::getServiceName)
        .field("ServiceVersion", LogRow::getServiceVersion)
        .field("Environment", LogRow::getEnvironment)
        .attributeMap(LogRow::getLogAttributes);

    public static final RowMapper<Edge<LogRow>> EDGE_MAPPER = (rs, rowNum) -> {
        LogRow row = fromResultSet(rs);
        return new Edge<>(Cursor.encode(row.getTimestamp(), row.getUuid()), row);
    };

    private Instant timestamp;
    private String uuid;
    private String severityText;
    private String body;
    private Map<String, String> logAttributes = new LinkedHashMap<>();
    private String traceId;
    private String spanId;
    private String secureSessionId;
    private String source;
    private String serviceName;
    private String serviceVersion;
    private String environment;

    static LogRow fromResultSet(ResultSet rs) throws SQLException {
        LogRow row = new LogRow();
        Timestamp timestamp = rs.getTimestamp("Timestamp");
        row.setTimestamp(timestamp == null ? null : timestamp.toInstant());
        row.setUuid(rs.getString("UUID"));
        row.setSeverityText(rs.getString("SeverityText"));
        row.setBody(rs.getString("Body"));
        row.setLogAttributes(stringMap(rs.getObject("LogAttributes")));
        row.setTraceId(rs.getString("TraceId"));
        row.setSpanId(rs.getString("SpanId"));
        row.setSecureSessionId(rs.getString("SecureSessionId"));
        row.setSource(rs.getString("Source"));
        row.setServiceName(rs.getString("ServiceName"));
        row.setServiceVersion(rs.getString("ServiceVersion"));
        row.setEnvironment(rs.getString("Environment"));
        return row;
    }

    static Map<String, String> stringMap(Object value) {
        Map<String, String> result = new LinkedHashMap<>();
        if (value instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                result.put(String.valueOf(entry.getKey()), entry.getValue() == null ? "" : entry.getValue().toString());
            }
        }
        return result;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getUuid() {
        return uuid;
    }

    public void setUuid(String uuid) {
        this.uuid = uuid;
    }

    public String getSeverityText() {
        return severityText;
    }

    public void setSeverityText(String severityText) {
        this.severityText = severityText;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public Map<String, String> getLogAttributes() {
        return logAttributes;
    }

    public void setLogAttributes(Map<String, String> logAttributes) {
        this.logAttributes = logAttributes;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getSpanId() {
        return spanId;
    }

    public void setSpanId(String spanId) {
        this.spanId = spanId;
    }

    public String getSecureSessionId() {
        return secureSessionId;
    }

    public void setSecureSessionId(String secureSessionId) {
        this.secureSessionId = secureSessionId;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    public String getServiceVersion() {
        return serviceVersion;
    }

    public void setServiceVersion(String serviceVersion) {
        this.serviceVersion = serviceVersion;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }
}
