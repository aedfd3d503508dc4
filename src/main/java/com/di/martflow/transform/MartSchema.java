package com.di.martflow.transform;

import java.util.List;

/** Names of the relations the transformer publishes in the {@code mart} schema. */
public final class MartSchema {

    public static final String SCHEMA = "mart";

    public static final String DIM_CUSTOMERS = "dim_customers";
    public static final String DIM_PRODUCTS = "dim_products";
    public static final String FACT_ORDERS = "fact_orders";
    public static final String METRICS_DAILY = "metrics_daily";
    public static final String CUSTOMER_ROLLUPS = "customer_rollups";

    /** Macro publishing {@link RetentionSegment} boundaries to the engine. */
    public static final String RETENTION_SEGMENT_MACRO = "retention_segment";

    /** The relations whose joint presence makes the warehouse queryable. */
    public static final List<String> CORE_RELATIONS = List.of(DIM_CUSTOMERS, DIM_PRODUCTS, FACT_ORDERS);

    public static final List<String> ALL_RELATIONS =
            List.of(DIM_CUSTOMERS, DIM_PRODUCTS, FACT_ORDERS, METRICS_DAILY, CUSTOMER_ROLLUPS);

    private MartSchema() {
    }

    public static String qualified(String relation) {
        return SCHEMA + "." + relation;
    }
}
