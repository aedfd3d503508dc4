package com.di.martflow.controller;

import com.di.martflow.controller.dto.QueryRunRequest;
import com.di.martflow.pipeline.EtlOutcome;
import com.di.martflow.pipeline.FullRunOutcome;
import com.di.martflow.pipeline.PipelineState;
import com.di.martflow.pipeline.WarehouseInspector;
import com.di.martflow.pipeline.WarehousePipeline;
import com.di.martflow.query.QueryRunReport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST surface of the warehouse pipeline.
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>POST</td><td>/api/warehouse/etl?verbose=</td><td>Rebuild the warehouse from the raw sources</td></tr>
 * <tr><td>GET</td><td>/api/warehouse/queries</td><td>Catalog names in document order</td></tr>
 * <tr><td>POST</td><td>/api/warehouse/queries/run</td><td>Run or explain one statement, or all</td></tr>
 * <tr><td>POST</td><td>/api/warehouse/full?verbose=&amp;explain=</td><td>ETL then every statement</td></tr>
 * <tr><td>GET</td><td>/api/warehouse/state</td><td>Phase of the persisted warehouse</td></tr>
 * </table>
 *
 * <p>All endpoints are synchronous.
 */
@RestController
@RequestMapping("/api/warehouse")
@Slf4j
@RequiredArgsConstructor
public class WarehouseController {

    private final WarehousePipeline pipeline;
    private final WarehouseInspector inspector;

    @PostMapping("/etl")
    public ResponseEntity<EtlOutcome> runEtl(@RequestParam(defaultValue = "false") boolean verbose) {
        log.info("[CONTROLLER] POST /api/warehouse/etl verbose={}", verbose);
        return ResponseEntity.ok(pipeline.runEtl(verbose));
    }

    @GetMapping("/queries")
    public ResponseEntity<List<String>> listQueries() {
        return ResponseEntity.ok(pipeline.listQueries());
    }

    @PostMapping("/queries/run")
    public ResponseEntity<QueryRunReport> runQueries(@Valid @RequestBody(required = false) QueryRunRequest request) {
        QueryRunRequest req = request != null ? request : new QueryRunRequest();
        log.info("[CONTROLLER] POST /api/warehouse/queries/run name={} explain={}",
                req.getName() != null ? req.getName() : "<all>", req.isExplain());
        return ResponseEntity.ok(pipeline.runQueries(req.getName(), req.isExplain()));
    }

    @PostMapping("/full")
    public ResponseEntity<FullRunOutcome> runFull(@RequestParam(defaultValue = "false") boolean verbose,
                                                  @RequestParam(defaultValue = "false") boolean explain) {
        log.info("[CONTROLLER] POST /api/warehouse/full verbose={} explain={}", verbose, explain);
        return ResponseEntity.ok(pipeline.runFull(verbose, explain));
    }

    @GetMapping("/state")
    public ResponseEntity<PipelineState> state() {
        return ResponseEntity.ok(inspector.detectState());
    }
}
