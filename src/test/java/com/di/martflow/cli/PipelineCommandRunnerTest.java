package com.di.martflow.cli;

import com.di.martflow.support.WarehouseFixture;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineCommandRunner Tests")
class PipelineCommandRunnerTest {

    private static final String BUNDLED = "classpath:sql/analytics_queries.sql";

    @TempDir
    Path tempDir;

    private WarehouseFixture fixture;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    @AfterEach
    void tearDown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    private PipelineCommandRunner runner(String catalogLocation) {
        return new PipelineCommandRunner(fixture.pipeline(catalogLocation),
                new ObjectMapper().findAndRegisterModules(),
                new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Recognises pipeline commands in raw arguments")
    void testIsCommand() {
        assertTrue(PipelineCommandRunner.isCommand("etl", "--verbose"));
        assertTrue(PipelineCommandRunner.isCommand("full"));
        assertFalse(PipelineCommandRunner.isCommand("--server.port=9000"));
        assertFalse(PipelineCommandRunner.isCommand());
    }

    @Test
    @DisplayName("No command leaves the application serving REST")
    void testNoCommand() {
        fixture = WarehouseFixture.create(tempDir);
        PipelineCommandRunner runner = runner(BUNDLED);

        runner.run(new DefaultApplicationArguments("--server.port=9000"));

        assertEquals(PipelineCommandRunner.EXIT_OK, runner.getExitCode());
        assertEquals("", output());
    }

    @Test
    @DisplayName("etl prints the outcome and exits 0")
    void testEtl() {
        fixture = WarehouseFixture.create(tempDir).singleUsOrder();
        PipelineCommandRunner runner = runner(BUNDLED);

        runner.run(new DefaultApplicationArguments("etl", "--verbose"));

        assertEquals(PipelineCommandRunner.EXIT_OK, runner.getExitCode());
        assertTrue(output().contains("\"recordsLoaded\" : 3"), output());
    }

    @Test
    @DisplayName("list prints catalog names")
    void testList() {
        fixture = WarehouseFixture.create(tempDir);
        PipelineCommandRunner runner = runner(BUNDLED);

        runner.run(new DefaultApplicationArguments("list"));

        assertTrue(output().contains("rolling_revenue_14d"));
    }

    @Test
    @DisplayName("queries --name=X runs one report after an ETL")
    void testQueriesByName() {
        fixture = WarehouseFixture.create(tempDir).singleUsOrder();
        PipelineCommandRunner runner = runner(BUNDLED);
        runner.run(new DefaultApplicationArguments("etl"));
        out.reset();

        runner.run(new DefaultApplicationArguments("queries", "--name=revenue_last_30d_by_country"));

        assertEquals(PipelineCommandRunner.EXIT_OK, runner.getExitCode());
        assertTrue(output().contains("\"US\""), output());
    }

    @Test
    @DisplayName("A failing statement among several exits 1; a command failure exits 2")
    void testExitCodes() throws IOException {
        fixture = WarehouseFixture.create(tempDir).singleUsOrder();
        Path catalog = Files.writeString(tempDir.resolve("mixed.sql"),
                "-- name: ok\nSELECT 1 AS one;\n-- name: broken\nSELECT * FROM mart.missing;\n");
        PipelineCommandRunner runner = runner("file:" + catalog);

        runner.run(new DefaultApplicationArguments("full"));
        assertEquals(PipelineCommandRunner.EXIT_PARTIAL, runner.getExitCode());

        runner.run(new DefaultApplicationArguments("queries", "--name=unknown"));
        assertEquals(PipelineCommandRunner.EXIT_FAILED, runner.getExitCode());
    }

    @Test
    @DisplayName("An unknown command is a usage error")
    void testUnknownCommand() {
        fixture = WarehouseFixture.create(tempDir);
        PipelineCommandRunner runner = runner(BUNDLED);

        runner.run(new DefaultApplicationArguments("bogus"));

        assertEquals(PipelineCommandRunner.EXIT_USAGE, runner.getExitCode());
    }
}
