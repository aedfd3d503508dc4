package com.di.martflow.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.File;

/**
 * Warehouse connection wiring. The pool is capped at one connection: the pipeline owns the
 * DuckDB file exclusively for the duration of a run.
 */
@Slf4j
@Configuration
public class WarehouseDataSourceConfig {

    static final String DUCKDB_DRIVER = "org.duckdb.DuckDBDriver";

    @Bean(destroyMethod = "close")
    public HikariDataSource warehouseDataSource(MartFlowProperties properties) {
        return createDataSource(properties.getWarehouse());
    }

    @Bean
    public JdbcTemplate warehouseJdbcTemplate(HikariDataSource warehouseDataSource,
                                              MartFlowProperties properties) {
        return createJdbcTemplate(warehouseDataSource, properties.getQuery().getTimeoutSeconds());
    }

    @Bean
    public DataSourceTransactionManager warehouseTransactionManager(HikariDataSource warehouseDataSource) {
        return new DataSourceTransactionManager(warehouseDataSource);
    }

    @Bean
    public TransactionTemplate warehouseTransactionTemplate(DataSourceTransactionManager warehouseTransactionManager) {
        return new TransactionTemplate(warehouseTransactionManager);
    }

    /**
     * Builds the single-connection pool for the given warehouse settings. Creates the parent
     * directory of the database file when it does not exist yet.
     */
    public static HikariDataSource createDataSource(MartFlowProperties.Warehouse warehouse) {
        String path = warehouse.getPath();
        if (path != null && !path.isBlank()) {
            File parent = new File(path.trim()).getAbsoluteFile().getParentFile();
            if (parent != null && !parent.exists() && !parent.mkdirs()) {
                log.warn("[WAREHOUSE] could not create directory {}", parent);
            }
        }

        HikariConfig config = new HikariConfig();
        config.setPoolName("martflow-warehouse");
        config.setDriverClassName(DUCKDB_DRIVER);
        config.setJdbcUrl(warehouse.getJdbcUrl());
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(warehouse.getConnectionTimeoutMs());
        // keep the single connection for the life of the pool; an in-memory database dies with it
        config.setMaxLifetime(0);
        config.setIdleTimeout(0);
        config.setAutoCommit(true);

        log.info("[WAREHOUSE] opening {} (pool size 1)", warehouse.getJdbcUrl());
        return new HikariDataSource(config);
    }

    public static JdbcTemplate createJdbcTemplate(HikariDataSource dataSource, int timeoutSeconds) {
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.setQueryTimeout(timeoutSeconds);
        return jdbc;
    }
}
