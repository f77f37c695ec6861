package com.strata.query.decode;

import com.strata.domain.MetricBucket;
import com.strata.domain.MetricsBuckets;
import com.strata.storage.ResultColumn;
import com.strata.storage.ResultRows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Decodes untyped result rows of user authored metric SQL into buckets.
 *
 * Column names select the role of each value: a {@code _group} suffix marks a
 * grouping column, a {@code _series} suffix a value column. A temporal column
 * with neither suffix is the bucket itself, a string or boolean one is a
 * group, and a numeric one is a value. Each value column yields one bucket
 * per row, labelled with the column name minus its suffix.
 */
public final class RowDecoder {
    private static final Logger log = LoggerFactory.getLogger(RowDecoder.class);

    public static final String GROUP_SUFFIX = "_group";
    public static final String SERIES_SUFFIX = "_series";

    private static final DateTimeFormatter RFC_3339 =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX").withZone(ZoneOffset.UTC);

    private RowDecoder() {
    }

    public static MetricsBuckets decode(ResultRows rows) {
        MetricsBuckets metrics = new MetricsBuckets();
        for (List<Object> row : rows.getRows()) {
            metrics.getBuckets().addAll(decodeRow(rows.getColumns(), row));
        }
        return metrics;
    }

    public static List<MetricBucket> decodeRow(List<ResultColumn> columns, List<Object> row) {
        long bucketId = 0;
        Double bucketValue = null;
        List<String> groups = new ArrayList<>();
        // column index -> value, null meaning the column held no value
        Map<Integer, Double> results = new LinkedHashMap<>();

        for (int idx = 0; idx < columns.size(); idx++) {
            String columnName = columns.get(idx).getName();
            boolean isSeries = columnName.endsWith(SERIES_SUFFIX);
            boolean isGroup = columnName.endsWith(GROUP_SUFFIX);
            Object value = unwrap(row.get(idx));

            if (value == null) {
                if (isGroup) {
                    groups.add("");
                } else {
                    results.put(idx, null);
                }
                continue;
            }

            Instant instant = toInstant(value);
            if (instant != null) {
                if (isSeries) {
                    results.put(idx, (double) instant.getEpochSecond());
                } else if (isGroup) {
                    groups.add(RFC_3339.format(instant));
                } else {
                    bucketId = instant.getEpochSecond();
                    bucketValue = (double) instant.getEpochSecond();
                }
            } else if (value instanceof CharSequence || value instanceof UUID) {
                String text = value.toString();
                if (isSeries) {
                    try {
                        results.put(idx, Double.parseDouble(text));
                    } catch (NumberFormatException e) {
                        log.warn("Ignoring non-numeric value in series column {}: {}", columnName, text);
                    }
                } else {
                    groups.add(text);
                }
            } else if (value instanceof Boolean) {
                boolean flag = (Boolean) value;
                if (isSeries) {
                    results.put(idx, flag ? 1.0 : 0.0);
                } else {
                    groups.add(String.valueOf(flag));
                }
            } else if (value instanceof Number) {
                Number number = (Number) value;
                if (isGroup) {
                    groups.add(formatNumber(number));
                } else {
                    results.put(idx, number.doubleValue());
                }
            } else {
                log.debug("Skipping column {} of unsupported type {}", columnName, value.getClass().getName());
            }
        }

        List<MetricBucket> buckets = new ArrayList<>(results.size());
        for (Map.Entry<Integer, Double> result : results.entrySet()) {
            MetricBucket bucket = new MetricBucket();
            bucket.setBucketId(bucketId);
            bucket.setBucketValue(bucketValue);
            bucket.setGroup(groups);
            bucket.setMetricType(label(columns.get(result.getKey()).getName()));
            bucket.setMetricValue(result.getValue());
            buckets.add(bucket);
        }
        return buckets;
    }

    static String label(String columnName) {
        String label = columnName;
        if (label.endsWith(SERIES_SUFFIX)) {
            label = label.substring(0, label.length() - SERIES_SUFFIX.length());
        }
        if (label.endsWith(GROUP_SUFFIX)) {
            label = label.substring(0, label.length() - GROUP_SUFFIX.length());
        }
        return label;
    }

    private static Object unwrap(Object value) {
        Object current = value;
        while (current instanceof Optional) {
            current = ((Optional<?>) current).orElse(null);
        }
        return current;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        return null;
    }

    private static String formatNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Double.toString(d);
            }
            return new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString();
        }
        if (number instanceof BigDecimal) {
            return ((BigDecimal) number).stripTrailingZeros().toPlainString();
        }
        if (number instanceof BigInteger) {
            return number.toString();
        }
        return Long.toString(number.longValue());
    }
}
