package com.di.martflow.pipeline;

/**
 * Warehouse lifecycle within one run.
 *
 * <pre>
 *   EMPTY ──stage──▶ STAGED ──transform──▶ READY
 * </pre>
 * There is no way back to EMPTY other than starting a fresh run.
 */
public enum PipelinePhase {
    EMPTY,
    STAGED,
    READY
}
