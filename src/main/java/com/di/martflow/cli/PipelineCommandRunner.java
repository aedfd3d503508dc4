package com.di.martflow.cli;

import com.di.martflow.exception.ErrorCategory;
import com.di.martflow.exception.MartFlowException;
import com.di.martflow.pipeline.FullRunOutcome;
import com.di.martflow.pipeline.WarehousePipeline;
import com.di.martflow.query.QueryRunReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Set;

/**
 * Runs one pipeline command when the application is started with one:
 * <pre>
 *   etl [--verbose]
 *   list
 *   queries [--name=X] [--explain]
 *   full [--verbose] [--explain]
 * </pre>
 * The outcome is printed to stdout as JSON. Exit codes: 0 success, 1 some catalog statements
 * failed, 2 the command failed, 64 usage error. Without a command the runner does nothing and the
 * REST surface serves requests.
 */
@Slf4j
@Component
public class PipelineCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final Set<String> COMMANDS = Set.of("etl", "list", "queries", "full");

    static final int EXIT_OK = 0;
    static final int EXIT_PARTIAL = 1;
    static final int EXIT_FAILED = 2;
    static final int EXIT_USAGE = 64;

    private final WarehousePipeline pipeline;
    private final ObjectMapper printer;
    private final PrintStream out;
    private int exitCode = EXIT_OK;

    @Autowired
    public PipelineCommandRunner(WarehousePipeline pipeline, ObjectMapper objectMapper) {
        this(pipeline, objectMapper, System.out);
    }

    PipelineCommandRunner(WarehousePipeline pipeline, ObjectMapper objectMapper, PrintStream out) {
        this.pipeline = pipeline;
        this.printer = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.out = out;
    }

    /** True when the raw program arguments start with a pipeline command. */
    public static boolean isCommand(String... args) {
        return args.length > 0 && COMMANDS.contains(args[0]);
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            log.debug("[CLI] no command given; serving REST only");
            return;
        }
        String command = commands.get(0);
        boolean verbose = args.containsOption("verbose");
        boolean explain = args.containsOption("explain");
        String name = optionValue(args, "name");

        try {
            switch (command) {
                case "etl" -> print(pipeline.runEtl(verbose));
                case "list" -> print(pipeline.listQueries());
                case "queries" -> {
                    QueryRunReport report = pipeline.runQueries(name, explain);
                    print(report);
                    exitCode = report.isAllSucceeded() ? EXIT_OK : EXIT_PARTIAL;
                }
                case "full" -> {
                    FullRunOutcome outcome = pipeline.runFull(verbose, explain);
                    print(outcome);
                    exitCode = outcome.getQueries().isAllSucceeded() ? EXIT_OK : EXIT_PARTIAL;
                }
                default -> {
                    log.error("[CLI] unknown command '{}'; expected one of {}", command, COMMANDS);
                    exitCode = EXIT_USAGE;
                }
            }
        } catch (MartFlowException e) {
            log.error("[CLI] '{}' failed [{}]: {}", command, e.getCategory().getName(), e.getMessage());
            exitCode = EXIT_FAILED;
        } catch (RuntimeException e) {
            log.error("[CLI] '{}' failed [{}]", command, ErrorCategory.categorize(e).getName(), e);
            exitCode = EXIT_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void print(Object value) {
        try {
            out.println(printer.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render command output", e);
        }
    }

    private static String optionValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
