package com.di.martflow.pipeline;

import com.di.martflow.exception.PreconditionNotMetException;
import com.di.martflow.ingest.StagingSource;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable phase value handed from component to component within one run. Nothing holds it
 * globally, so two runs (or two tests) never share state.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PipelineState {

    PipelinePhase phase;
    Set<StagingSource> stagedSources;

    public static PipelineState empty() {
        return new PipelineState(PipelinePhase.EMPTY, Collections.emptySet());
    }

    /** State of a warehouse whose dimension and fact relations already exist. */
    public static PipelineState ready() {
        return new PipelineState(PipelinePhase.READY, Collections.unmodifiableSet(EnumSet.allOf(StagingSource.class)));
    }

    /** State of a warehouse that holds the given staging relations but no complete mart. */
    public static PipelineState staged(Set<StagingSource> sources) {
        if (sources.isEmpty()) {
            return empty();
        }
        return new PipelineState(PipelinePhase.STAGED, Collections.unmodifiableSet(EnumSet.copyOf(sources)));
    }

    /** {@code EMPTY|STAGED → STAGED}: records one more staged source. */
    public PipelineState withStaged(StagingSource source) {
        requireStageable();
        EnumSet<StagingSource> next = stagedSources.isEmpty()
                ? EnumSet.noneOf(StagingSource.class)
                : EnumSet.copyOf(stagedSources);
        next.add(source);
        return new PipelineState(PipelinePhase.STAGED, Collections.unmodifiableSet(next));
    }

    /** {@code STAGED → READY}: only when every required source has been staged. */
    public PipelineState toReady() {
        Set<StagingSource> missing = missingSources();
        if (phase != PipelinePhase.STAGED || !missing.isEmpty()) {
            throw new PreconditionNotMetException(String.format(
                    "Cannot transform in phase %s: staging missing for %s", phase, missing));
        }
        return new PipelineState(PipelinePhase.READY, stagedSources);
    }

    public Set<StagingSource> missingSources() {
        EnumSet<StagingSource> missing = EnumSet.allOf(StagingSource.class);
        missing.removeAll(stagedSources);
        return missing;
    }

    public boolean isReady() {
        return phase == PipelinePhase.READY;
    }

    /** Staging is only allowed before the warehouse is built; a rerun starts from {@link #empty()}. */
    public void requireStageable() {
        if (phase == PipelinePhase.READY) {
            throw new PreconditionNotMetException(
                    "Warehouse is already READY; start a fresh run to stage sources again");
        }
    }

    public void requireReady(String operation) {
        if (phase != PipelinePhase.READY) {
            throw new PreconditionNotMetException(String.format(
                    "'%s' requires the warehouse to be READY but it is %s; run the ETL first", operation, phase));
        }
    }
}
