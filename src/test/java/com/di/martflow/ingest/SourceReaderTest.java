package com.di.martflow.ingest;

import com.di.martflow.exception.PreconditionNotMetException;
import com.di.martflow.exception.RecordMalformedException;
import com.di.martflow.exception.SourceUnavailableException;
import com.di.martflow.pipeline.PipelinePhase;
import com.di.martflow.pipeline.PipelineState;
import com.di.martflow.support.WarehouseFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Staging against a real DuckDB file. Each test builds its own fixture.
 */
@DisplayName("SourceReader Tests")
class SourceReaderTest {

    @TempDir
    Path tempDir;

    private WarehouseFixture fixture;

    @AfterEach
    void tearDown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    private static final String[] ORDERS_WITH_BAD_ROWS = {
            "O1,C1,P1,2023-08-01 10:00:00,completed,2,10.0",
            "O2,C1,P1,2023-08-02 10:00:00,completed,two,10.0",
            "O3,C1,P1,2023-08-03 10:00:00,completed",
            "O4,C1,P1,2023-08-04 10:00:00,,1,5.0"
    };

    // ============================================================================
    // Happy path
    // ============================================================================

    @Test
    @DisplayName("stageAll stages the three sources and reaches STAGED")
    void testStageAll() {
        fixture = WarehouseFixture.create(tempDir).singleUsOrder();

        IngestOutcome outcome = fixture.sourceReader().stageAll(PipelineState.empty());

        assertEquals(PipelinePhase.STAGED, outcome.getState().getPhase());
        assertEquals(EnumSet.allOf(StagingSource.class), outcome.getState().getStagedSources());
        assertEquals(3, outcome.getRecordsLoaded());
        assertEquals(0, outcome.getRecordsSkipped());
        assertEquals(1, fixture.count("staging.orders"));
        assertEquals(List.of(1L), fixture.jdbc().queryForList("SELECT source_row FROM staging.orders", Long.class));
    }

    @Test
    @DisplayName("Sources may be staged one at a time, accumulating state")
    void testStage_Incremental() {
        fixture = WarehouseFixture.create(tempDir).singleUsOrder();

        PipelineState state = fixture.sourceReader().stage(PipelineState.empty(), StagingSource.CUSTOMERS).getState();
        assertEquals(EnumSet.of(StagingSource.PRODUCTS, StagingSource.ORDERS), state.missingSources());

        state = fixture.sourceReader().stage(state, StagingSource.PRODUCTS, StagingSource.ORDERS).getState();
        assertTrue(state.missingSources().isEmpty());
    }

    @Test
    @DisplayName("Header matching ignores case, order, whitespace and a BOM; quoted commas survive")
    void testStage_HeaderAndQuoting() {
        fixture = WarehouseFixture.create(tempDir).singleUsOrder();
        fixture.writeRaw(StagingSource.CUSTOMERS,
                "\uFEFFCountry, customer_id ,name,signup_date,extra\n"
                        + "US,C1,\"Smith, Jane\",2023-01-15,ignored\n");

        fixture.sourceReader().stage(PipelineState.empty(), StagingSource.CUSTOMERS);

        assertEquals("Smith, Jane",
                fixture.jdbc().queryForObject("SELECT name FROM staging.customers WHERE customer_id = 'C1'", String.class));
        assertEquals("US",
                fixture.jdbc().queryForObject("SELECT country FROM staging.customers", String.class));
    }

    // ============================================================================
    // Malformed records
    // ============================================================================

    @Test
    @DisplayName("SKIP drops malformed records, counts them and keeps original row numbers")
    void testStage_SkipPolicy() {
        fixture = WarehouseFixture.create(tempDir, MalformedRecordPolicy.SKIP)
                .singleUsOrder()
                .orders(ORDERS_WITH_BAD_ROWS);

        IngestOutcome outcome = fixture.sourceReader().stage(PipelineState.empty(), StagingSource.ORDERS);

        StageResult orders = outcome.getResults().get(0);
        assertEquals(4, orders.getRecordsRead());
        assertEquals(2, orders.getRecordsLoaded());
        assertEquals(2, orders.getRecordsSkipped());
        assertEquals(List.of(1L, 4L),
                fixture.jdbc().queryForList("SELECT source_row FROM staging.orders ORDER BY source_row", Long.class));
        assertNull(fixture.jdbc().queryForObject("SELECT status FROM staging.orders WHERE order_id = 'O4'", String.class));
    }

    @Test
    @DisplayName("ABORT fails on the first malformed record and stages nothing")
    void testStage_AbortPolicy() {
        fixture = WarehouseFixture.create(tempDir, MalformedRecordPolicy.ABORT)
                .singleUsOrder()
                .orders(ORDERS_WITH_BAD_ROWS);

        RecordMalformedException e = assertThrows(RecordMalformedException.class,
                () -> fixture.sourceReader().stageAll(PipelineState.empty()));

        assertEquals("orders", e.getSource());
        assertEquals(2, e.getRecordIndex());
        assertEquals("quantity", e.getColumn());
        assertTrue(fixture.inspector().existingTables(StagingSource.STAGING_SCHEMA).isEmpty());
    }

    // ============================================================================
    // Unavailable sources
    // ============================================================================

    @Test
    @DisplayName("A missing source aborts before anything is staged")
    void testStage_MissingSource() {
        fixture = WarehouseFixture.create(tempDir)
                .customers("C1,Alice,US,2023-01-15")
                .orders("O1,C1,P1,2023-08-01 10:00:00,completed,2,10.0");

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                () -> fixture.sourceReader().stageAll(PipelineState.empty()));

        assertEquals("products", e.getSource());
        assertTrue(fixture.inspector().existingTables(StagingSource.STAGING_SCHEMA).isEmpty());
    }

    @Test
    @DisplayName("A header without a declared column makes the source unavailable")
    void testStage_MissingColumn() {
        fixture = WarehouseFixture.create(tempDir).singleUsOrder();
        fixture.writeRaw(StagingSource.CUSTOMERS, "customer_id,name\nC1,Alice\n");

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                () -> fixture.sourceReader().stage(PipelineState.empty(), StagingSource.CUSTOMERS));
        assertTrue(e.getMessage().contains("country"), e.getMessage());
    }

    @Test
    @DisplayName("An empty file has no header and is unavailable")
    void testStage_EmptyFile() {
        fixture = WarehouseFixture.create(tempDir).singleUsOrder();
        fixture.writeRaw(StagingSource.PRODUCTS, "");

        assertThrows(SourceUnavailableException.class,
                () -> fixture.sourceReader().stage(PipelineState.empty(), StagingSource.PRODUCTS));
    }

    @Test
    @DisplayName("Staging a READY warehouse is rejected")
    void testStage_ReadyState() {
        fixture = WarehouseFixture.create(tempDir).singleUsOrder();
        assertThrows(PreconditionNotMetException.class,
                () -> fixture.sourceReader().stageAll(PipelineState.ready()));
    }
}
