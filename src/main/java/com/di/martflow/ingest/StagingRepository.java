package com.di.martflow.ingest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JDBC access to the {@code staging} schema. Callers own the transaction boundary.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class StagingRepository {

    private final JdbcTemplate jdbc;

    // ------------------------------------------------------------------
    // DDL
    // ------------------------------------------------------------------

    /** Creates the staging schema if needed and replaces the source's table with an empty one. */
    public void recreateTable(StagingSource source) {
        jdbc.execute("CREATE SCHEMA IF NOT EXISTS " + StagingSource.STAGING_SCHEMA);
        String columns = source.columns().stream()
                .map(c -> c.name() + " " + c.type().sqlType())
                .collect(Collectors.joining(", "));
        jdbc.execute("CREATE OR REPLACE TABLE " + source.qualifiedTable()
                + " (" + StagingSource.SOURCE_ROW_COLUMN + " BIGINT, " + columns + ")");
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /**
     * Inserts coerced records. Each row is {@code [sourceRow, value1, value2, ...]} with values
     * in declared column order.
     */
    public void insertBatch(StagingSource source, List<Object[]> rows) {
        if (rows.isEmpty()) {
            return;
        }
        List<ColumnSpec> columns = source.columns();
        String placeholders = columns.stream()
                .map(c -> c.type().placeholder())
                .collect(Collectors.joining(", "));
        String sql = "INSERT INTO " + source.qualifiedTable() + " VALUES (?, " + placeholders + ")";

        jdbc.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                Object[] row = rows.get(i);
                ps.setLong(1, (Long) row[0]);
                for (int c = 0; c < columns.size(); c++) {
                    bind(ps, c + 2, columns.get(c).type(), row[c + 1]);
                }
            }

            @Override
            public int getBatchSize() {
                return rows.size();
            }
        });
        log.debug("[INGEST] {} <- {} row(s)", source.qualifiedTable(), rows.size());
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public long count(StagingSource source) {
        Long cnt = jdbc.queryForObject("SELECT COUNT(*) FROM " + source.qualifiedTable(), Long.class);
        return cnt == null ? 0L : cnt;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void bind(PreparedStatement ps, int index, ColumnType type, Object value) throws SQLException {
        Object bound = RecordCoercer.toBindValue(value);
        if (bound == null) {
            ps.setNull(index, type.bindType());
            return;
        }
        switch (type) {
            case BIGINT -> ps.setLong(index, (Long) bound);
            case DOUBLE -> ps.setDouble(index, (Double) bound);
            default -> ps.setString(index, (String) bound);
        }
    }
}
