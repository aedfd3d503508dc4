package com.di.martflow.pipeline;

import com.di.martflow.ingest.StagingSource;
import com.di.martflow.transform.MartSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/**
 * Reads the engine catalog to find out which relations exist. Used to derive the state of a
 * persisted warehouse when a process starts with queries only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WarehouseInspector {

    private final JdbcTemplate jdbc;

    public Set<String> existingTables(String schema) {
        return new HashSet<>(jdbc.queryForList(
                "SELECT table_name FROM information_schema.tables WHERE table_schema = ?",
                String.class, schema));
    }

    /**
     * READY when all core mart relations exist (they are only ever created together), otherwise
     * STAGED with whatever staging relations exist, otherwise EMPTY.
     */
    public PipelineState detectState() {
        Set<String> mart = existingTables(MartSchema.SCHEMA);
        if (mart.containsAll(MartSchema.CORE_RELATIONS)) {
            log.debug("[PIPELINE] persisted warehouse is READY");
            return PipelineState.ready();
        }
        Set<String> staging = existingTables(StagingSource.STAGING_SCHEMA);
        Set<StagingSource> staged = EnumSet.noneOf(StagingSource.class);
        for (StagingSource s : StagingSource.values()) {
            if (staging.contains(s.tableName())) {
                staged.add(s);
            }
        }
        PipelineState state = PipelineState.staged(staged);
        log.debug("[PIPELINE] persisted warehouse is {} (staged={})", state.getPhase(), staged);
        return state;
    }
}
