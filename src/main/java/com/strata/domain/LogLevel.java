package com.strata.domain;

import java.util.Locale;

public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    /**
     * Maps a free-form severity string onto a level, defaulting to INFO.
     */
    public static LogLevel fromSeverity(String severity) {
        if (severity == null) {
            return INFO;
        }
        switch (severity.trim().toLowerCase(Locale.ROOT)) {
            case "trace":
                return TRACE;
            case "debug":
                return DEBUG;
            case "warn":
            case "warning":
                return WARN;
            case "error":
                return ERROR;
            case "fatal":
            case "panic":
            case "critical":
                return FATAL;
            default:
                return INFO;
        }
    }
}
