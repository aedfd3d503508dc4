package com.di.martflow.pipeline;

import com.di.martflow.ingest.StageResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Summary of one ETL run: what was staged, what was dropped and which relations now exist. */
@Value
@Builder
public class EtlOutcome {
    String runId;
    long recordsLoaded;
    long recordsSkipped;
    long orphanRows;
    long statusExcluded;
    List<String> relationsBuilt;
    List<StageResult> stages;
    long elapsedMs;
    String warehousePath;
    /** READY state produced by the transform; what follow-on queries in the same run start from. */
    @JsonIgnore
    PipelineState state;
}
