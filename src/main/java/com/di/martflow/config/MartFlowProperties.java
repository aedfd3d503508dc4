package com.di.martflow.config;

import com.di.martflow.ingest.MalformedRecordPolicy;
import com.di.martflow.ingest.StagingSource;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Single binding for all pipeline configuration ({@code martflow.*}).
 *
 * <pre>
 * martflow:
 *   warehouse:
 *     path: data/warehouse.duckdb
 *   sources:
 *     customers: data/raw/customers.csv
 *     products: data/raw/products.csv
 *     orders: data/raw/orders.csv
 *   ingest:
 *     malformed-policy: SKIP
 *   transform:
 *     excluded-statuses: cancelled,refunded
 *   catalog:
 *     location: classpath:sql/analytics_queries.sql
 *   query:
 *     explain-analyze: false
 *     timeout-seconds: -1
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "martflow")
public class MartFlowProperties {

    private Warehouse warehouse = new Warehouse();
    private Sources sources = new Sources();
    private Ingest ingest = new Ingest();
    private Transform transform = new Transform();
    private Catalog catalog = new Catalog();
    private Query query = new Query();

    @Data
    public static class Warehouse {
        /** DuckDB database file. Blank = in-memory database (lost when the pool closes). */
        private String path = "data/warehouse.duckdb";
        private long connectionTimeoutMs = 30_000;

        public String getJdbcUrl() {
            return (path == null || path.isBlank()) ? "jdbc:duckdb:" : "jdbc:duckdb:" + path.trim();
        }
    }

    @Data
    public static class Sources {
        private String customers = "data/raw/customers.csv";
        private String products = "data/raw/products.csv";
        private String orders = "data/raw/orders.csv";

        public String locationOf(StagingSource source) {
            return switch (source) {
                case CUSTOMERS -> customers;
                case PRODUCTS -> products;
                case ORDERS -> orders;
            };
        }
    }

    @Data
    public static class Ingest {
        private MalformedRecordPolicy malformedPolicy = MalformedRecordPolicy.SKIP;
    }

    @Data
    public static class Transform {
        /** Comma-separated order statuses that never become facts (compared lower-case). */
        private String excludedStatuses = "cancelled,refunded";

        public List<String> getExcludedStatusList() {
            if (excludedStatuses == null || excludedStatuses.isBlank()) return List.of();
            List<String> out = new ArrayList<>();
            for (String s : excludedStatuses.split(",")) {
                String trimmed = s.trim().toLowerCase(Locale.ROOT);
                if (!trimmed.isEmpty()) out.add(trimmed);
            }
            return out;
        }
    }

    @Data
    public static class Catalog {
        /** Spring resource location of the named-query document. */
        private String location = "classpath:sql/analytics_queries.sql";
    }

    @Data
    public static class Query {
        /** When true, explain uses EXPLAIN ANALYZE (runs the statement, always rolled back). */
        private boolean explainAnalyze = false;
        /** Statement timeout handed to the JDBC driver; -1 leaves the driver default. */
        private int timeoutSeconds = -1;
    }
}
