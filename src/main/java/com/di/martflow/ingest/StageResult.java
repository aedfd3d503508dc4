package com.di.martflow.ingest;

import lombok.Builder;
import lombok.Value;

/** Outcome of staging one raw source. */
@Value
@Builder
public class StageResult {
    StagingSource source;
    String location;
    /** Data rows read from the file (header excluded). */
    long recordsRead;
    long recordsLoaded;
    long recordsSkipped;
}
