package com.strata.query.metrics;

import com.strata.domain.MetricAggregator;

/**
 * ClickHouse aggregate expressions for each {@link MetricAggregator}.
 *
 * State forms produce mergeable partial aggregates for the metric history
 * table. Final forms produce the value returned to callers. Counts and sums
 * are scaled by the sample factor.
 */
public final class AggregatorFunctions {

    private AggregatorFunctions() {
    }

    public static String aggregate(MetricAggregator aggregator, String column, boolean useSampling, boolean useState) {
        switch (aggregator) {
            case COUNT:
                if (useState) {
                    return "countState()";
                }
                return useSampling ? "round(count() * any(_sample_factor))" : "round(count() * 1.0)";
            case COUNT_DISTINCT:
            case COUNT_DISTINCT_KEY:
                if (useState) {
                    return "uniqState(toString(" + column + "))";
                }
                return "round(count(distinct " + column + ") * 1.0)";
            case MIN:
                return useState ? "minState(toFloat64(" + column + "))" : "toFloat64(min(" + column + "))";
            case AVG:
                return useState ? "avgState(toFloat64(" + column + "))" : "avg(" + column + ")";
            case P50:
            case P90:
            case P95:
            case P99:
                String level = quantileLevel(aggregator);
                return useState
                    ? "quantileState(" + level + ")(toFloat64(" + column + "))"
                    : "quantile(" + level + ")(" + column + ")";
            case MAX:
                return useState ? "maxState(toFloat64(" + column + "))" : "toFloat64(max(" + column + "))";
            case SUM:
                if (useState) {
                    return "sumState(toFloat64(" + column + "))";
                }
                return useSampling ? "sum(" + column + ") * any(_sample_factor)" : "sum(" + column + ") * 1.0";
            default:
                throw new IllegalArgumentException("Unsupported aggregator: " + aggregator);
        }
    }

    /**
     * Unscaled aggregate used to rank groups for top-N limiting.
     */
    public static String limit(MetricAggregator aggregator, String column) {
        switch (aggregator) {
            case COUNT:
                return "count()";
            case COUNT_DISTINCT:
            case COUNT_DISTINCT_KEY:
                return "count(distinct " + column + ")";
            case MIN:
                return "min(" + column + ")";
            case AVG:
                return "avg(" + column + ")";
            case P50:
            case P90:
            case P95:
            case P99:
                return "quantile(" + quantileLevel(aggregator) + ")(" + column + ")";
            case MAX:
                return "max(" + column + ")";
            case SUM:
                return "sum(" + column + ")";
            default:
                throw new IllegalArgumentException("Unsupported aggregator: " + aggregator);
        }
    }

    /**
     * Column of the metric history table holding the state of {@code aggregator}.
     */
    public static String stateColumn(MetricAggregator aggregator) {
        switch (aggregator) {
            case COUNT:
                return "CountState";
            case COUNT_DISTINCT:
            case COUNT_DISTINCT_KEY:
                return "UniqState";
            case MIN:
                return "MinState";
            case AVG:
                return "AvgState";
            case MAX:
                return "MaxState";
            case SUM:
                return "SumState";
            case P50:
                return "P50State";
            case P90:
                return "P90State";
            case P95:
                return "P95State";
            case P99:
                return "P99State";
            default:
                throw new IllegalArgumentException("Unsupported aggregator: " + aggregator);
        }
    }

    private static String quantileLevel(MetricAggregator aggregator) {
        switch (aggregator) {
            case P50:
                return ".5";
            case P90:
                return ".9";
            case P95:
                return ".95";
            default:
                return ".99";
        }
    }
}
