package com.di.martflow.ingest;

import com.di.martflow.config.MartFlowProperties;
import com.di.martflow.exception.RecordMalformedException;
import com.di.martflow.exception.SourceUnavailableException;
import com.di.martflow.pipeline.PipelineState;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the raw CSV sources into typed staging tables.
 *
 * <pre>
 *   check   every source exists and is readable   (SourceUnavailable → nothing staged)
 *   stage   per source, inside ONE transaction:
 *             CREATE OR REPLACE staging.&lt;source&gt;
 *             header → column positions            (missing column → SourceUnavailable)
 *             record → coerce → batch insert       (malformed → SKIP+count | ABORT)
 * </pre>
 */
@Service
@Slf4j
public class SourceReader {

    static final int BATCH_SIZE = 1_000;
    private static final int MAX_LOGGED_SKIPS = 20;

    private final StagingRepository stagingRepository;
    private final TransactionTemplate transactionTemplate;
    private final MartFlowProperties properties;
    private final CsvMapper csvMapper;

    public SourceReader(StagingRepository stagingRepository,
                        TransactionTemplate transactionTemplate,
                        MartFlowProperties properties) {
        this.stagingRepository = stagingRepository;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    /* ==================================================================== */
    /* Entry points                                                          */
    /* ==================================================================== */

    /**
     * Stages all three sources as one unit. Availability of every source is checked before
     * anything is written.
     */
    public IngestOutcome stageAll(PipelineState state) {
        return stage(state, StagingSource.values());
    }

    /** Stages the given sources in one transaction and returns the resulting state. */
    public IngestOutcome stage(PipelineState state, StagingSource... sources) {
        Map<StagingSource, Path> paths = new EnumMap<>(StagingSource.class);
        for (StagingSource source : sources) {
            paths.put(source, checkAvailable(source));
        }
        state.requireStageable();

        List<StageResult> results = transactionTemplate.execute(status -> {
            List<StageResult> out = new ArrayList<>();
            for (Map.Entry<StagingSource, Path> e : paths.entrySet()) {
                out.add(stageSource(e.getKey(), e.getValue()));
            }
            return out;
        });

        PipelineState next = state;
        IngestOutcome.IngestOutcomeBuilder outcome = IngestOutcome.builder();
        for (StageResult r : results) {
            next = next.withStaged(r.getSource());
            outcome.result(r);
        }
        return outcome.state(next).build();
    }

    /**
     * Resolves the configured location of a source and verifies it can be opened.
     *
     * @throws SourceUnavailableException when the file is missing, not a file or unreadable
     */
    public Path checkAvailable(StagingSource source) {
        String location = properties.getSources().locationOf(source);
        if (location == null || location.isBlank()) {
            throw new SourceUnavailableException(source.sourceName(), String.valueOf(location), "no location configured");
        }
        Path path = Paths.get(location.trim());
        if (!Files.exists(path)) {
            throw new SourceUnavailableException(source.sourceName(), location, "file does not exist");
        }
        if (!Files.isRegularFile(path)) {
            throw new SourceUnavailableException(source.sourceName(), location, "not a regular file");
        }
        if (!Files.isReadable(path)) {
            throw new SourceUnavailableException(source.sourceName(), location, "file is not readable");
        }
        return path;
    }

    /* ==================================================================== */
    /* Per-source load                                                       */
    /* ==================================================================== */

    private StageResult stageSource(StagingSource source, Path path) {
        MalformedRecordPolicy policy = properties.getIngest().getMalformedPolicy();
        log.info("[INGEST] {} <- {} (policy={})", source.qualifiedTable(), path, policy);

        stagingRepository.recreateTable(source);

        long read = 0;
        long loaded = 0;
        long skipped = 0;
        List<Object[]> batch = new ArrayList<>(BATCH_SIZE);

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<String[]> it = csvMapper.readerFor(String[].class).readValues(reader)) {

            int[] positions = resolveHeader(source, path, it);
            int headerWidth = positions[positions.length - 1];

            while (true) {
                String[] fields;
                try {
                    if (!it.hasNextValue()) {
                        break;
                    }
                    fields = it.nextValue();
                } catch (IOException e) {
                    // the tokenizer cannot resynchronise after this; no policy can skip it
                    throw new RecordMalformedException(source.sourceName(), read + 1, null,
                            "unparseable CSV: " + e.getMessage(), e);
                }
                read++;

                Object[] values;
                try {
                    values = coerce(source, positions, headerWidth, fields);
                } catch (FieldCoercionException e) {
                    if (policy == MalformedRecordPolicy.ABORT) {
                        throw new RecordMalformedException(source.sourceName(), read, e.getColumn(), e.getMessage());
                    }
                    skipped++;
                    if (skipped <= MAX_LOGGED_SKIPS) {
                        log.warn("[INGEST] skipping record {} of '{}'{}: {}", read, source.sourceName(),
                                e.getColumn() == null ? "" : " column '" + e.getColumn() + "'", e.getMessage());
                    }
                    continue;
                }

                Object[] row = new Object[values.length + 1];
                row[0] = read;
                System.arraycopy(values, 0, row, 1, values.length);
                batch.add(row);
                if (batch.size() >= BATCH_SIZE) {
                    stagingRepository.insertBatch(source, batch);
                    loaded += batch.size();
                    batch = new ArrayList<>(BATCH_SIZE);
                }
            }
            stagingRepository.insertBatch(source, batch);
            loaded += batch.size();
        } catch (IOException e) {
            throw new SourceUnavailableException(source.sourceName(), path.toString(), "read failed: " + e.getMessage(), e);
        }

        if (skipped > MAX_LOGGED_SKIPS) {
            log.warn("[INGEST] '{}': {} further skipped record(s) not logged individually",
                    source.sourceName(), skipped - MAX_LOGGED_SKIPS);
        }
        log.info("[INGEST] {} read={} loaded={} skipped={}", source.qualifiedTable(), read, loaded, skipped);

        return StageResult.builder()
                .source(source)
                .location(path.toString())
                .recordsRead(read)
                .recordsLoaded(loaded)
                .recordsSkipped(skipped)
                .build();
    }

    /**
     * Maps declared columns to their CSV positions. The returned array holds one position per
     * declared column followed by the header width.
     */
    private int[] resolveHeader(StagingSource source, Path path, MappingIterator<String[]> it) throws IOException {
        if (!it.hasNextValue()) {
            throw new SourceUnavailableException(source.sourceName(), path.toString(), "file is empty (no header row)");
        }
        String[] header = it.nextValue();
        if (header.length > 0 && header[0] != null && header[0].startsWith("\uFEFF")) {
            header[0] = header[0].substring(1);
        }

        List<ColumnSpec> columns = source.columns();
        int[] positions = new int[columns.size() + 1];
        List<String> missing = new ArrayList<>();
        for (int c = 0; c < columns.size(); c++) {
            positions[c] = indexOf(header, columns.get(c).name());
            if (positions[c] < 0) {
                missing.add(columns.get(c).name());
            }
        }
        if (!missing.isEmpty()) {
            throw new SourceUnavailableException(source.sourceName(), path.toString(),
                    "missing required column(s) " + missing + " in header " + Arrays.toString(header));
        }
        positions[columns.size()] = header.length;
        return positions;
    }

    private static Object[] coerce(StagingSource source, int[] positions, int headerWidth, String[] fields)
            throws FieldCoercionException {
        if (fields.length != headerWidth) {
            throw new FieldCoercionException(null,
                    String.format("expected %d field(s) but found %d", headerWidth, fields.length));
        }
        List<ColumnSpec> columns = source.columns();
        String[] aligned = new String[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            aligned[c] = fields[positions[c]];
        }
        return RecordCoercer.coerceRecord(columns, aligned);
    }

    private static int indexOf(String[] header, String column) {
        for (int i = 0; i < header.length; i++) {
            if (header[i] != null && header[i].trim().toLowerCase(Locale.ROOT).equals(column)) {
                return i;
            }
        }
        return -1;
    }
}
