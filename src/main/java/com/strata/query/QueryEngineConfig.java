package com.strata.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Engine limits and the clock used to default missing date ranges
 */
@Configuration
public class QueryEngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngineConfig.class);

    @Value("${strata.query.max-buckets:240}")
    private int maxBuckets;

    @Value("${strata.query.default-buckets:48}")
    private int defaultBuckets;

    @Value("${strata.query.max-result-rows:10000}")
    private int maxResultRows;

    @Value("${strata.query.sampling-rows:20000000}")
    private long samplingRows;

    @Value("${strata.query.keys-max-rows:1000000}")
    private long keysMaxRows;

    @Value("${strata.query.key-values-max-rows:1000000}")
    private long keyValuesMaxRows;

    @Value("${strata.query.all-key-values-max-rows:100000000}")
    private long allKeyValuesMaxRows;

    @Value("${strata.query.default-page-size:50}")
    private int defaultPageSize;

    @Value("${strata.query.log-lines-limit:1000}")
    private int logLinesLimit;

    @Bean
    public QueryLimits queryLimits() {
        QueryLimits limits = new QueryLimits(maxBuckets, defaultBuckets, maxResultRows, samplingRows,
            keysMaxRows, keyValuesMaxRows, allKeyValuesMaxRows, defaultPageSize, logLinesLimit);
        logger.info("Query limits: maxBuckets={}, defaultBuckets={}, maxResultRows={}, samplingRows={}",
            maxBuckets, defaultBuckets, maxResultRows, samplingRows);
        return limits;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
