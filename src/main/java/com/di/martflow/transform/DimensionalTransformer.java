package com.di.martflow.transform;

import com.di.martflow.config.MartFlowProperties;
import com.di.martflow.exception.PreconditionNotMetException;
import com.di.martflow.ingest.StagingSource;
import com.di.martflow.pipeline.PipelineState;
import com.di.martflow.pipeline.WarehouseInspector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the dimensional warehouse from staging.
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────────┐
 * │ ONE TRANSACTION                                                   │
 * │   dim_customers   first-seen row per customer_id (min source_row) │
 * │   dim_products    first-seen row per product_id                   │
 * │   fact_orders     orders ⋈ dim_customers ⋈ dim_products           │
 * │                   minus excluded statuses, minus orphans          │
 * │                   gross_revenue = quantity × unit_price           │
 * │   metrics_daily, customer_rollups, retention_segment macro        │
 * │   reconcile: staged orders = facts + orphans + excluded           │
 * ├──────────────────────────────────────────────────────────────────┤
 * │ AFTER COMMIT   ANALYZE                                            │
 * └──────────────────────────────────────────────────────────────────┘
 * </pre>
 */
@Service
@Slf4j
public class DimensionalTransformer {

    /** The only place the revenue measure is derived. */
    static final String GROSS_REVENUE_EXPR = "o.quantity * o.unit_price";

    private static final String DIM_CUSTOMERS_SQL = """
            CREATE OR REPLACE TABLE mart.dim_customers AS
            SELECT customer_id, name, country, signup_date
            FROM (
                SELECT *, ROW_NUMBER() OVER (PARTITION BY customer_id ORDER BY source_row) AS seen_rank
                FROM staging.customers
            ) ranked
            WHERE seen_rank = 1
            ORDER BY customer_id
            """;

    private static final String DIM_PRODUCTS_SQL = """
            CREATE OR REPLACE TABLE mart.dim_products AS
            SELECT product_id, name, category, unit_price AS base_price
            FROM (
                SELECT *, ROW_NUMBER() OVER (PARTITION BY product_id ORDER BY source_row) AS seen_rank
                FROM staging.products
            ) ranked
            WHERE seen_rank = 1
            ORDER BY product_id
            """;

    private static final String FACT_ORDERS_SQL = """
            CREATE OR REPLACE TABLE mart.fact_orders AS
            SELECT
                o.order_id,
                o.customer_id,
                o.product_id,
                o.order_timestamp AS order_ts,
                LOWER(o.status) AS status,
                o.quantity,
                o.unit_price,
                %s AS gross_revenue
            FROM staging.orders o
            JOIN mart.dim_customers c ON c.customer_id = o.customer_id
            JOIN mart.dim_products p ON p.product_id = o.product_id
            WHERE %s
            ORDER BY o.source_row
            """;

    private static final String ORPHAN_COUNT_SQL = """
            SELECT COUNT(*)
            FROM staging.orders o
            WHERE %s
              AND (NOT EXISTS (SELECT 1 FROM mart.dim_customers c WHERE c.customer_id = o.customer_id)
                OR NOT EXISTS (SELECT 1 FROM mart.dim_products p WHERE p.product_id = o.product_id))
            """;

    private static final String METRICS_DAILY_SQL = """
            CREATE OR REPLACE TABLE mart.metrics_daily AS
            SELECT
                CAST(order_ts AS DATE) AS order_date,
                SUM(gross_revenue) AS revenue,
                SUM(quantity) AS units,
                COUNT(*) AS orders,
                APPROX_QUANTILE(gross_revenue, 0.95) AS p95_revenue
            FROM mart.fact_orders
            GROUP BY 1
            ORDER BY 1
            """;

    private static final String CUSTOMER_ROLLUPS_SQL = """
            CREATE OR REPLACE TABLE mart.customer_rollups AS
            SELECT
                customer_id,
                COUNT(*) AS order_count,
                SUM(gross_revenue) AS total_revenue,
                MIN(order_ts) AS first_order_ts,
                MAX(order_ts) AS last_order_ts,
                AVG(gross_revenue) AS avg_ticket,
                SUM(quantity) AS units,
                ROW_NUMBER() OVER (ORDER BY SUM(gross_revenue) DESC, customer_id) AS revenue_rank
            FROM mart.fact_orders
            GROUP BY customer_id
            """;

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final WarehouseInspector inspector;
    private final MartFlowProperties properties;

    public DimensionalTransformer(JdbcTemplate jdbc,
                                  TransactionTemplate transactionTemplate,
                                  WarehouseInspector inspector,
                                  MartFlowProperties properties) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
        this.inspector = inspector;
        this.properties = properties;
    }

    /* ==================================================================== */
    /* Entry point                                                           */
    /* ==================================================================== */

    /**
     * Moves the warehouse from STAGED to READY.
     *
     * @throws PreconditionNotMetException when any required staging relation is missing,
     *                                     either from the run state or from the engine
     */
    public TransformOutcome transform(PipelineState state) {
        PipelineState ready = state.toReady();
        requireStagingTables();

        long t0 = System.currentTimeMillis();
        String keep = keepStatusPredicate(properties.getTransform().getExcludedStatusList());

        TransformOutcome.TransformOutcomeBuilder outcome = transactionTemplate.execute(status -> buildMart(keep));

        // statistics refresh is not transactional; run it against the committed relations
        jdbc.execute("ANALYZE");
        long elapsed = System.currentTimeMillis() - t0;

        TransformOutcome result = outcome.state(ready).elapsedMs(elapsed).build();
        log.info("[TRANSFORM] done in {} ms: customers={} products={} facts={} orphans={} statusExcluded={}",
                elapsed, result.getCustomers(), result.getProducts(), result.getFacts(),
                result.getOrphanRows(), result.getStatusExcluded());
        return result;
    }

    /* ==================================================================== */
    /* Internal                                                              */
    /* ==================================================================== */

    private TransformOutcome.TransformOutcomeBuilder buildMart(String keep) {
        jdbc.execute("CREATE SCHEMA IF NOT EXISTS " + MartSchema.SCHEMA);
        List<String> built = new ArrayList<>();

        jdbc.execute(DIM_CUSTOMERS_SQL);
        built.add(MartSchema.qualified(MartSchema.DIM_CUSTOMERS));
        jdbc.execute(DIM_PRODUCTS_SQL);
        built.add(MartSchema.qualified(MartSchema.DIM_PRODUCTS));

        long stagedOrders = count("SELECT COUNT(*) FROM staging.orders");
        long excluded = count("SELECT COUNT(*) FROM staging.orders o WHERE NOT (" + keep + ")");
        long orphans = count(String.format(ORPHAN_COUNT_SQL, keep));

        jdbc.execute(String.format(FACT_ORDERS_SQL, GROSS_REVENUE_EXPR, keep));
        built.add(MartSchema.qualified(MartSchema.FACT_ORDERS));

        jdbc.execute(METRICS_DAILY_SQL);
        built.add(MartSchema.qualified(MartSchema.METRICS_DAILY));
        jdbc.execute(CUSTOMER_ROLLUPS_SQL);
        built.add(MartSchema.qualified(MartSchema.CUSTOMER_ROLLUPS));

        jdbc.execute("CREATE OR REPLACE MACRO " + MartSchema.qualified(MartSchema.RETENTION_SEGMENT_MACRO)
                + "(days) AS " + RetentionSegment.toSqlCase("days"));

        long customers = count("SELECT COUNT(*) FROM mart.dim_customers");
        long products = count("SELECT COUNT(*) FROM mart.dim_products");
        long facts = count("SELECT COUNT(*) FROM mart.fact_orders");

        reconcile(stagedOrders, facts, orphans, excluded);
        if (orphans > 0) {
            log.warn("[TRANSFORM] dropped {} orphan order row(s) with no matching customer or product", orphans);
        }

        return TransformOutcome.builder()
                .customers(customers)
                .products(products)
                .facts(facts)
                .orphanRows(orphans)
                .statusExcluded(excluded)
                .relationsBuilt(List.copyOf(built));
    }

    /** Every staged order must be accounted for exactly once; a mismatch rolls the build back. */
    private static void reconcile(long stagedOrders, long facts, long orphans, long excluded) {
        long accounted = facts + orphans + excluded;
        String detail = String.format("staged=%,d facts=%,d orphans=%,d excluded=%,d",
                stagedOrders, facts, orphans, excluded);
        if (accounted != stagedOrders) {
            throw new IllegalStateException("[TRANSFORM] order reconciliation failed: " + detail);
        }
        log.info("[TRANSFORM] reconcile {} -> PASS", detail);
    }

    private void requireStagingTables() {
        Set<String> present = inspector.existingTables(StagingSource.STAGING_SCHEMA);
        Set<StagingSource> missing = EnumSet.noneOf(StagingSource.class);
        for (StagingSource s : StagingSource.values()) {
            if (!present.contains(s.tableName())) {
                missing.add(s);
            }
        }
        if (!missing.isEmpty()) {
            throw new PreconditionNotMetException("Staging relation(s) absent: " + missing.stream()
                    .map(StagingSource::qualifiedTable)
                    .collect(Collectors.joining(", ")));
        }
    }

    /**
     * Predicate (over alias {@code o}) that keeps orders whose status is not excluded.
     * A NULL status is never excluded.
     */
    static String keepStatusPredicate(List<String> excludedStatuses) {
        if (excludedStatuses.isEmpty()) {
            return "TRUE";
        }
        String literals = excludedStatuses.stream()
                .map(s -> "'" + s.replace("'", "''") + "'")
                .collect(Collectors.joining(", "));
        return "COALESCE(LOWER(o.status), '') NOT IN (" + literals + ")";
    }

    private long count(String sql) {
        Long cnt = jdbc.queryForObject(sql, Long.class);
        return cnt == null ? 0L : cnt;
    }
}
