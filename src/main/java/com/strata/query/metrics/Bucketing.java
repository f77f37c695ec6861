package com.strata.query.metrics;

import com.strata.domain.DateRange;
import com.strata.domain.MetricBucketBy;
import com.strata.domain.MetricsRequest;
import com.strata.domain.TableConfig;
import com.strata.query.AttributeResolver;
import com.strata.query.InvalidQueryException;
import com.strata.query.QueryLimits;
import com.strata.query.SelectBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Bucket count and bucket index expressions for metric queries.
 *
 * The index of a row is {@code floor((expr - min) * n / (max - min))}. For
 * timestamp and none bucketing, min and max are the query range bounds;
 * otherwise they are window aggregates over the bucketed expression.
 */
public final class Bucketing {

    public static final String BUCKET_INDEX_ALIAS = "__strata_bucket_index";
    public static final String MIN_ALIAS = "__strata_min";
    public static final String MAX_ALIAS = "__strata_max";

    private Bucketing() {
    }

    public static BucketingInfo compute(TableConfig config, MetricsRequest request, DateRange dateRange,
                                        SelectBuilder sb, QueryLimits limits) {
        String bucketBy = request.getBucketBy() == null ? MetricBucketBy.NONE.getValue() : request.getBucketBy();
        int maxBuckets = limits.getMaxBuckets();
        Instant start = dateRange.getStartDate();
        Instant end = dateRange.getEndDate();

        int bucketCount = limits.getDefaultBuckets();
        if (request.getBucketWindow() == null) {
            if (MetricBucketBy.NONE.matches(bucketBy)) {
                bucketCount = 1;
            } else if (request.getBucketCount() != null) {
                bucketCount = request.getBucketCount();
            }
            if (bucketCount > maxBuckets && !request.isNoBucketMax()) {
                bucketCount = maxBuckets;
            }
        } else {
            long window = request.getBucketWindow();
            if (window <= 0) {
                throw new InvalidQueryException("Bucket window must be positive, found " + window);
            }
            long count = dateRange.getDuration().getSeconds() / window;
            if (count > maxBuckets && !request.isNoBucketMax()) {
                count = maxBuckets;
                start = end.minusSeconds(maxBuckets * window);
            }
            bucketCount = (int) Math.min(count, Integer.MAX_VALUE);
        }
        bucketCount = Math.max(bucketCount, 1);

        String bucketExpr = "toFloat64(Timestamp)";
        List<String> attributeFields = new ArrayList<>();
        boolean rangeBounded = MetricBucketBy.NONE.matches(bucketBy) || MetricBucketBy.TIMESTAMP.matches(bucketBy);
        if (!rangeBounded) {
            String column = AttributeResolver.column(config, bucketBy.toLowerCase(Locale.ROOT));
            if (column != null) {
                bucketExpr = "toFloat64(" + column + ")";
            } else {
                bucketExpr = AttributeResolver.attribute(sb, config, bucketBy, "toFloat64OrNull");
                attributeFields.add(bucketBy);
            }
        }

        String minExpr = "MIN(" + bucketExpr + ") OVER ()";
        String maxExpr = "MAX(" + bucketExpr + ") OVER ()";
        if (rangeBounded) {
            minExpr = start.getEpochSecond() + ".0";
            maxExpr = end.getEpochSecond() + ".0";
        }

        String indexExpr = String.format("toUInt64(intDiv((%s - %s) * %d, (%s - %s)))",
            bucketExpr, minExpr, bucketCount, maxExpr, minExpr);
        List<String> selectItems = List.of(
            sb.as(indexExpr, BUCKET_INDEX_ALIAS),
            sb.as(minExpr, MIN_ALIAS),
            sb.as(maxExpr, MAX_ALIAS));

        return new BucketingInfo(selectItems, attributeFields, bucketCount, start);
    }
}
