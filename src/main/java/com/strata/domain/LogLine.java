package com.strata.domain;

import java.time.Instant;

/**
 * A raw log line with its attributes rendered as nested JSON labels
 */
public class LogLine {
    private final Instant timestamp;
    private final String body;
    private final LogLevel severity;
    private final String labels;

    public LogLine(Instant timestamp, String body, LogLevel severity, String labels) {
        this.timestamp = timestamp;
        this.body = body;
        this.severity = severity;
        this.labels = labels;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getBody() {
        return body;
    }

    /**
     * @return the parsed level, or null when the row carried no severity
     */
    public LogLevel getSeverity() {
        return severity;
    }

    public String getLabels() {
        return labels;
    }
}
