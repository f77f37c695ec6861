package com.strata.query.metrics;

import com.strata.domain.MetricBucket;
import com.strata.domain.MetricExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns aggregate rows into metric buckets, filling every bucket id missing
 * from a group's series with a null valued bucket so each group covers
 * {@code 0..bucketCount-1} without gaps.
 */
final class BucketAssembler {
    private static final Logger logger = LoggerFactory.getLogger(BucketAssembler.class);

    private BucketAssembler() {
    }

    /**
     * @param rows       aggregate rows ordered by bucket id
     * @param fallbackMin range start used when no rows came back and the range is static
     * @param fallbackMax range end used in the same case
     */
    static List<MetricBucket> assemble(List<AggregateRow> rows, List<MetricExpression> expressions, int groupCount,
                                       int bucketCount, Double fallbackMin, Double fallbackMax) {
        Map<List<String>, Series> series = new LinkedHashMap<>();
        int stale = 0;
        for (AggregateRow row : rows) {
            if (row.getBucketId() >= bucketCount) {
                stale++;
                continue;
            }
            Series current = series.computeIfAbsent(row.getGroups(),
                groups -> new Series(groups, series.size()));
            for (long id = current.lastBucketId + 1; id < row.getBucketId(); id++) {
                current.add(id, row.getMin(), row.getMax(), bucketCount, expressions, null);
            }
            current.add(row.getBucketId(), row.getMin(), row.getMax(), bucketCount, expressions, row.getValues());
            current.lastBucketId = row.getBucketId();
            current.min = row.getMin();
            current.max = row.getMax();
        }
        if (stale > 0) {
            logger.warn("Dropped {} rows with bucket ids beyond the bucket count {}", stale, bucketCount);
        }

        if (series.isEmpty()) {
            Series empty = new Series(Collections.nCopies(groupCount, ""), 0);
            if (fallbackMin != null && fallbackMax != null) {
                empty.min = fallbackMin;
                empty.max = fallbackMax;
            }
            series.put(empty.groups, empty);
        }

        List<Series> ordered = new ArrayList<>(series.values());
        for (Series current : ordered) {
            for (long id = current.lastBucketId + 1; id < bucketCount; id++) {
                current.add(id, current.min, current.max, bucketCount, expressions, null);
            }
        }

        List<Entry> entries = new ArrayList<>();
        for (Series current : ordered) {
            entries.addAll(current.entries);
        }
        entries.sort(Comparator.comparingLong((Entry e) -> e.bucket.getBucketId())
            .thenComparingInt(e -> e.seriesIndex));

        List<MetricBucket> buckets = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            buckets.add(entry.bucket);
        }
        return buckets;
    }

    static double bucketBound(long index, double min, double max, int bucketCount) {
        return index * (max - min) / bucketCount + min;
    }

    private static final class Series {
        private final List<String> groups;
        private final int index;
        private final List<Entry> entries = new ArrayList<>();
        private long lastBucketId = -1;
        private double min;
        private double max;

        Series(List<String> groups, int index) {
            this.groups = groups;
            this.index = index;
        }

        void add(long bucketId, double min, double max, int bucketCount, List<MetricExpression> expressions,
                 List<Double> values) {
            for (int i = 0; i < expressions.size(); i++) {
                MetricExpression expression = expressions.get(i);
                MetricBucket bucket = new MetricBucket();
                bucket.setBucketId(bucketId);
                bucket.setBucketMin(bucketBound(bucketId, min, max, bucketCount));
                bucket.setBucketMax(bucketBound(bucketId + 1, min, max, bucketCount));
                bucket.setGroup(groups);
                bucket.setMetricType(expression.getAggregator().name());
                bucket.setColumn(expression.getColumn());
                bucket.setMetricValue(values == null ? null : values.get(i));
                entries.add(new Entry(bucket, index));
            }
        }
    }

    private static final class Entry {
        private final MetricBucket bucket;
        private final int seriesIndex;

        Entry(MetricBucket bucket, int seriesIndex) {
            this.bucket = bucket;
            this.seriesIndex = seriesIndex;
        }
    }
}
