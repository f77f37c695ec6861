package com.strata.query.metrics;

import java.time.Instant;
import java.util.List;

/**
 * Bucketing derived for one metric request: the select items computing the
 * bucket index and range, attribute fields they read, the bucket count and
 * the effective range start after window capping.
 */
public class BucketingInfo {
    private final List<String> selectItems;
    private final List<String> attributeFields;
    private final int bucketCount;
    private final Instant startDate;

    public BucketingInfo(List<String> selectItems, List<String> attributeFields, int bucketCount, Instant startDate) {
        this.selectItems = List.copyOf(selectItems);
        this.attributeFields = List.copyOf(attributeFields);
        this.bucketCount = bucketCount;
        this.startDate = startDate;
    }

    public List<String> getSelectItems() {
        return selectItems;
    }

    public List<String> getAttributeFields() {
        return attributeFields;
    }

    public int getBucketCount() {
        return bucketCount;
    }

    public Instant getStartDate() {
        return startDate;
    }
}
