package com.di.martflow.support;

import com.di.martflow.catalog.QueryCatalogLoader;
import com.di.martflow.catalog.QueryCatalogParser;
import com.di.martflow.config.MartFlowProperties;
import com.di.martflow.config.WarehouseDataSourceConfig;
import com.di.martflow.ingest.MalformedRecordPolicy;
import com.di.martflow.ingest.SourceReader;
import com.di.martflow.ingest.StagingRepository;
import com.di.martflow.ingest.StagingSource;
import com.di.martflow.pipeline.PipelineState;
import com.di.martflow.pipeline.WarehouseInspector;
import com.di.martflow.pipeline.WarehousePipeline;
import com.di.martflow.query.QueryExecutor;
import com.di.martflow.transform.DimensionalTransformer;
import com.di.martflow.transform.TransformOutcome;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Wires the pipeline components by hand against a DuckDB file in a temporary directory.
 * Close it after each test to release the database file.
 */
public final class WarehouseFixture implements AutoCloseable {

    public static final String CUSTOMERS_HEADER = "customer_id,name,country,signup_date";
    public static final String PRODUCTS_HEADER = "product_id,name,category,unit_price";
    public static final String ORDERS_HEADER = "order_id,customer_id,product_id,order_timestamp,status,quantity,unit_price";

    private final Path dir;
    private final MartFlowProperties properties;
    private final HikariDataSource dataSource;
    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final WarehouseInspector inspector;
    private final SourceReader sourceReader;
    private final DimensionalTransformer transformer;
    private final QueryCatalogParser parser;
    private final QueryExecutor executor;

    private WarehouseFixture(Path dir, MartFlowProperties properties) {
        this.dir = dir;
        this.properties = properties;
        this.dataSource = WarehouseDataSourceConfig.createDataSource(properties.getWarehouse());
        this.jdbc = WarehouseDataSourceConfig.createJdbcTemplate(dataSource, properties.getQuery().getTimeoutSeconds());
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.inspector = new WarehouseInspector(jdbc);
        this.sourceReader = new SourceReader(new StagingRepository(jdbc), transactionTemplate, properties);
        this.transformer = new DimensionalTransformer(jdbc, transactionTemplate, inspector, properties);
        this.parser = new QueryCatalogParser();
        this.executor = new QueryExecutor(jdbc, transactionTemplate, properties);
    }

    public static WarehouseFixture create(Path dir) {
        return create(dir, MalformedRecordPolicy.SKIP);
    }

    public static WarehouseFixture create(Path dir, MalformedRecordPolicy policy) {
        MartFlowProperties properties = new MartFlowProperties();
        properties.getWarehouse().setPath(dir.resolve("db").resolve("warehouse.duckdb").toString());
        properties.getIngest().setMalformedPolicy(policy);
        properties.getSources().setCustomers(dir.resolve("customers.csv").toString());
        properties.getSources().setProducts(dir.resolve("products.csv").toString());
        properties.getSources().setOrders(dir.resolve("orders.csv").toString());
        return new WarehouseFixture(dir, properties);
    }

    /* ------------------------------------------------------------------ */
    /* Raw sources                                                          */
    /* ------------------------------------------------------------------ */

    public WarehouseFixture customers(String... rows) {
        write(StagingSource.CUSTOMERS, CUSTOMERS_HEADER, rows);
        return this;
    }

    public WarehouseFixture products(String... rows) {
        write(StagingSource.PRODUCTS, PRODUCTS_HEADER, rows);
        return this;
    }

    public WarehouseFixture orders(String... rows) {
        write(StagingSource.ORDERS, ORDERS_HEADER, rows);
        return this;
    }

    /** Writes a source file verbatim (header included). */
    public Path writeRaw(StagingSource source, String content) {
        Path file = Path.of(properties.getSources().locationOf(source));
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return file;
    }

    private void write(StagingSource source, String header, String... rows) {
        StringBuilder sb = new StringBuilder(header).append('\n');
        for (String row : rows) {
            sb.append(row).append('\n');
        }
        writeRaw(source, sb.toString());
    }

    /** The single-order data set: C1 in US buys two units of P1 at 10.0 on 2023-08-01. */
    public WarehouseFixture singleUsOrder() {
        return customers("C1,Alice,US,2023-01-15")
                .products("P1,Widget,A,10.0")
                .orders("O1,C1,P1,2023-08-01 10:00:00,completed,2,10.0");
    }

    /** Stages every source and builds the mart. */
    public TransformOutcome build() {
        return transformer.transform(sourceReader.stageAll(PipelineState.empty()).getState());
    }

    /** A pipeline over this fixture reading the given catalog resource location. */
    public WarehousePipeline pipeline(String catalogLocation) {
        properties.getCatalog().setLocation(catalogLocation);
        QueryCatalogLoader loader = new QueryCatalogLoader(new DefaultResourceLoader(), parser, properties);
        return new WarehousePipeline(sourceReader, transformer, loader, executor, inspector, properties);
    }

    /* ------------------------------------------------------------------ */
    /* Accessors                                                            */
    /* ------------------------------------------------------------------ */

    public Path dir() {
        return dir;
    }

    public MartFlowProperties properties() {
        return properties;
    }

    public JdbcTemplate jdbc() {
        return jdbc;
    }

    public TransactionTemplate transactionTemplate() {
        return transactionTemplate;
    }

    public WarehouseInspector inspector() {
        return inspector;
    }

    public SourceReader sourceReader() {
        return sourceReader;
    }

    public DimensionalTransformer transformer() {
        return transformer;
    }

    public QueryCatalogParser parser() {
        return parser;
    }

    public QueryExecutor executor() {
        return executor;
    }

    public long count(String relation) {
        Long n = jdbc.queryForObject("SELECT COUNT(*) FROM " + relation, Long.class);
        return n == null ? 0 : n;
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
