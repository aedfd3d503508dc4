package com.di.martflow.pipeline;

import com.di.martflow.catalog.QueryCatalog;
import com.di.martflow.catalog.QueryCatalogLoader;
import com.di.martflow.config.MartFlowProperties;
import com.di.martflow.ingest.IngestOutcome;
import com.di.martflow.ingest.SourceReader;
import com.di.martflow.ingest.StageResult;
import com.di.martflow.query.ExecutionResult;
import com.di.martflow.query.QueryExecutor;
import com.di.martflow.query.QueryOutcome;
import com.di.martflow.query.QueryRunReport;
import com.di.martflow.transform.DimensionalTransformer;
import com.di.martflow.transform.TransformOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Drives the warehouse through its phases for one run.
 *
 * <p>Flow for {@link #runEtl}:
 * <ol>
 *   <li>stage all three sources from a fresh {@link PipelineState#empty()} state</li>
 *   <li>build the dimensions, the fact table and the derived relations</li>
 * </ol>
 * Query operations derive the state from the persisted warehouse, so a process started only to
 * run reports works against an earlier ETL.
 *
 * <p>Each call carries its own {@link PipelineState}; nothing here is shared between runs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WarehousePipeline {

    static final String MDC_RUN_ID = "runId";

    private final SourceReader sourceReader;
    private final DimensionalTransformer transformer;
    private final QueryCatalogLoader catalogLoader;
    private final QueryExecutor queryExecutor;
    private final WarehouseInspector inspector;
    private final MartFlowProperties properties;

    /* ------------------------------------------------------------------ */
    /* ETL                                                                  */
    /* ------------------------------------------------------------------ */

    /**
     * Rebuilds the warehouse from the raw sources.
     *
     * @param verbose log every stage result and relation at INFO instead of DEBUG
     */
    public EtlOutcome runEtl(boolean verbose) {
        String runId = newRunId();
        String previous = MDC.get(MDC_RUN_ID);
        MDC.put(MDC_RUN_ID, runId);
        try {
            return etl(runId, verbose);
        } finally {
            restoreRunId(previous);
        }
    }

    private EtlOutcome etl(String runId, boolean verbose) {
        long t0 = System.currentTimeMillis();
        log.info("[PIPELINE] ETL started into {}", describeWarehouse());

        IngestOutcome ingest = sourceReader.stageAll(PipelineState.empty());
        for (StageResult r : ingest.getResults()) {
            detail(verbose, "[PIPELINE] staged {}: read={} loaded={} skipped={}",
                    r.getSource().sourceName(), r.getRecordsRead(), r.getRecordsLoaded(), r.getRecordsSkipped());
        }

        TransformOutcome transform = transformer.transform(ingest.getState());
        for (String relation : transform.getRelationsBuilt()) {
            detail(verbose, "[PIPELINE] built {}", relation);
        }

        EtlOutcome outcome = EtlOutcome.builder()
                .runId(runId)
                .recordsLoaded(ingest.getRecordsLoaded())
                .recordsSkipped(ingest.getRecordsSkipped())
                .orphanRows(transform.getOrphanRows())
                .statusExcluded(transform.getStatusExcluded())
                .relationsBuilt(transform.getRelationsBuilt())
                .stages(ingest.getResults())
                .elapsedMs(System.currentTimeMillis() - t0)
                .warehousePath(describeWarehouse())
                .state(transform.getState())
                .build();
        log.info("[PIPELINE] ETL finished in {} ms: loaded={} skipped={} orphans={} relations={}",
                outcome.getElapsedMs(), outcome.getRecordsLoaded(), outcome.getRecordsSkipped(),
                outcome.getOrphanRows(), outcome.getRelationsBuilt().size());
        return outcome;
    }

    /* ------------------------------------------------------------------ */
    /* Queries                                                              */
    /* ------------------------------------------------------------------ */

    /** Names of the catalog's statements in document order. */
    public List<String> listQueries() {
        return catalogLoader.load().names();
    }

    /**
     * Runs (or explains) one named statement, or every statement when {@code name} is null or
     * blank. A single named statement that fails propagates its error; in the all-statements case
     * each failure is recorded in the report instead.
     */
    public QueryRunReport runQueries(String name, boolean explain) {
        PipelineState state = inspector.detectState();
        QueryCatalog catalog = catalogLoader.load();
        if (name == null || name.isBlank()) {
            return queryExecutor.runAll(state, catalog, explain);
        }
        String trimmed = name.trim();
        ExecutionResult result = explain
                ? queryExecutor.explain(state, catalog, trimmed)
                : queryExecutor.run(state, catalog, trimmed);
        return new QueryRunReport(List.of(QueryOutcome.success(result)));
    }

    /* ------------------------------------------------------------------ */
    /* Full                                                                 */
    /* ------------------------------------------------------------------ */

    /** ETL followed by every catalog statement, under one run id. */
    public FullRunOutcome runFull(boolean verbose, boolean explain) {
        String runId = newRunId();
        String previous = MDC.get(MDC_RUN_ID);
        MDC.put(MDC_RUN_ID, runId);
        try {
            EtlOutcome etl = etl(runId, verbose);
            QueryRunReport queries = queryExecutor.runAll(etl.getState(), catalogLoader.load(), explain);
            return new FullRunOutcome(etl, queries);
        } finally {
            restoreRunId(previous);
        }
    }

    /* ------------------------------------------------------------------ */
    /* Helpers                                                              */
    /* ------------------------------------------------------------------ */

    private String describeWarehouse() {
        String path = properties.getWarehouse().getPath();
        return path == null || path.isBlank() ? "in-memory" : path;
    }

    private static String newRunId() {
        return "run-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static void restoreRunId(String previous) {
        if (previous != null) {
            MDC.put(MDC_RUN_ID, previous);
        } else {
            MDC.remove(MDC_RUN_ID);
        }
    }

    private static void detail(boolean verbose, String format, Object... args) {
        if (verbose) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
