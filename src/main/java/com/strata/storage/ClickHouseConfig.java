package com.strata.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Configuration for ClickHouse JDBC connections
 * Two pools: the primary one for generated queries and history inserts, and a
 * read-only one for user authored SQL
 */
@Configuration
public class ClickHouseConfig {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseConfig.class);

    private static final String DRIVER = "com.clickhouse.jdbc.ClickHouseDriver";

    @Value("${strata.storage.clickhouse.url:jdbc:clickhouse://localhost:8123/default}")
    private String url;

    @Value("${strata.storage.clickhouse.username:default}")
    private String username;

    @Value("${strata.storage.clickhouse.password:}")
    private String password;

    @Value("${strata.storage.clickhouse.pool.size:10}")
    private int poolSize;

    @Value("${strata.storage.clickhouse.readonly.url:jdbc:clickhouse://localhost:8123/default}")
    private String readonlyUrl;

    @Value("${strata.storage.clickhouse.readonly.username:default}")
    private String readonlyUsername;

    @Value("${strata.storage.clickhouse.readonly.password:}")
    private String readonlyPassword;

    @Value("${strata.storage.clickhouse.readonly.pool.size:5}")
    private int readonlyPoolSize;

    @Bean(name = "clickHouseDataSource")
    @Primary
    public DataSource clickHouseDataSource() {
        return createDataSource("strata-clickhouse", url, username, password, poolSize, false);
    }

    /**
     * Pool used for raw SQL. The connection is opened with {@code readonly=2} so
     * queries may still carry per-query settings but cannot write.
     */
    @Bean(name = "clickHouseReadonlyDataSource")
    public DataSource clickHouseReadonlyDataSource() {
        return createDataSource("strata-clickhouse-readonly", readonlyUrl, readonlyUsername, readonlyPassword,
            readonlyPoolSize, true);
    }

    @Bean(name = "clickHouseJdbcTemplate")
    @Primary
    public JdbcTemplate clickHouseJdbcTemplate(@Qualifier("clickHouseDataSource") DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean(name = "clickHouseReadonlyJdbcTemplate")
    public JdbcTemplate clickHouseReadonlyJdbcTemplate(
            @Qualifier("clickHouseReadonlyDataSource") DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean(name = "storeClient")
    @Primary
    public StoreClient storeClient(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbcTemplate,
                                   StoreMetrics storeMetrics) {
        return new JdbcStoreClient(jdbcTemplate, storeMetrics);
    }

    @Bean(name = "readonlyStoreClient")
    public StoreClient readonlyStoreClient(@Qualifier("clickHouseReadonlyJdbcTemplate") JdbcTemplate jdbcTemplate,
                                           StoreMetrics storeMetrics) {
        return new JdbcStoreClient(jdbcTemplate, storeMetrics);
    }

    private DataSource createDataSource(String poolName, String jdbcUrl, String user, String secret,
                                        int maxPoolSize, boolean readonly) {
        try {
            HikariConfig config = new HikariConfig();
            config.setPoolName(poolName);
            config.setJdbcUrl(jdbcUrl);
            config.setUsername(user);
            config.setPassword(secret);
            config.setDriverClassName(DRIVER);

            // Connection pool settings
            config.setMaximumPoolSize(maxPoolSize);
            config.setMinimumIdle(1);
            config.setConnectionTimeout(30000);
            config.setIdleTimeout(600000);
            config.setMaxLifetime(1800000);
            // Connections are never validated eagerly; ClickHouse is lazily reached over HTTP
            config.setInitializationFailTimeout(-1);

            // ClickHouse-specific settings
            config.addDataSourceProperty("socket_timeout", "300000");
            config.addDataSourceProperty("compress", "true");
            if (readonly) {
                config.addDataSourceProperty("custom_settings", "readonly=2");
            }

            HikariDataSource dataSource = new HikariDataSource(config);

            logger.info("ClickHouse DataSource {} initialized: {}", poolName, jdbcUrl);
            return dataSource;

        } catch (Exception e) {
            logger.error("Failed to initialize ClickHouse DataSource {}", poolName, e);
            throw new IllegalStateException("ClickHouse DataSource initialization failed", e);
        }
    }
}
