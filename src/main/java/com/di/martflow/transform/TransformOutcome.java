package com.di.martflow.transform;

import com.di.martflow.pipeline.PipelineState;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Row counts of a completed transformation and the READY state it produced. */
@Value
@Builder
public class TransformOutcome {
    PipelineState state;
    long customers;
    long products;
    long facts;
    /** Orders dropped because their customer or product key has no dimension row. */
    long orphanRows;
    /** Orders dropped because their status is excluded (cancelled, refunded, ...). */
    long statusExcluded;
    List<String> relationsBuilt;
    long elapsedMs;
}
