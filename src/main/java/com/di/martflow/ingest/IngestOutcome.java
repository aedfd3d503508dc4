package com.di.martflow.ingest;

import com.di.martflow.pipeline.PipelineState;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/** Result of a staging pass: per-source counts plus the pipeline state it leads to. */
@Value
@Builder
public class IngestOutcome {

    PipelineState state;

    @Singular
    List<StageResult> results;

    public long getRecordsLoaded() {
        return results.stream().mapToLong(StageResult::getRecordsLoaded).sum();
    }

    public long getRecordsSkipped() {
        return results.stream().mapToLong(StageResult::getRecordsSkipped).sum();
    }
}
