package com.trucksafe.elp.source;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import com.trucksafe.elp.model.InspectionRow;
import com.trucksafe.elp.model.ViolationRow;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Reads the two CSV exports downloaded from data.transportation.gov:
 *
 *   violations.csv   Vehicle Inspections and Violations (876r-jsdb)
 *   inspections.csv  Vehicle Inspection File (fx4q-ay7w)
 *
 * Both files run to millions of lines and are streamed in batches of
 * {@code batchSize} rows. The inspection stream stops as soon as the join
 * reports every wanted id resolved.
 *
 * A line whose field count differs from the header is skipped and counted,
 * as is a line the parser cannot read at all.
 */
@Slf4j
public class LocalCsvRecordSource implements RecordSource {

    private final Path violationsFile;
    private final Path inspectionsFile;
    private final int batchSize;
    private final SchemaRegistry schemas;

    public LocalCsvRecordSource(Path violationsFile, Path inspectionsFile, int batchSize, SchemaRegistry schemas) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        this.violationsFile = violationsFile;
        this.inspectionsFile = inspectionsFile;
        this.batchSize = batchSize;
        this.schemas = schemas;
    }

    @Override
    public String name() {
        return "csv";
    }

    @Override
    public int forEachViolationBatch(Consumer<List<ViolationRow>> consumer) {
        log.info("Streaming violations from {} in batches of {}", violationsFile, batchSize);
        return this.<ViolationRow>stream(violationsFile, "Violations", schemas::violationSchema, batch -> {
            consumer.accept(batch);
            return true;
        });
    }

    @Override
    public int forEachInspectionBatch(Predicate<List<InspectionRow>> consumer) {
        log.info("Streaming inspections from {} in batches of {}", inspectionsFile, batchSize);
        return this.<InspectionRow>stream(inspectionsFile, "Inspections", schemas::inspectionSchema, consumer);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> int stream(Path file,
                           String kind,
                           Function<List<String>, SchemaAdapter<T>> schemaFor,
                           Predicate<List<T>> consumer) {
        int delivered = 0;
        int malformed = 0;

        try (Reader in = open(file);
             CSVReader reader = new CSVReader(in)) {

            String[] header = readHeader(reader, file);
            if (header == null) {
                log.warn("{} file {} is empty", kind, file);
                return 0;
            }
            SchemaAdapter<T> schema = schemaFor.apply(Arrays.asList(header));
            log.info("{} file uses schema '{}'", kind, schema.name());

            List<T> batch = new ArrayList<>(Math.min(batchSize, 10_000));
            boolean keepGoing = true;

            while (keepGoing) {
                String[] fields;
                try {
                    fields = reader.readNext();
                } catch (CsvValidationException e) {
                    malformed++;
                    continue;
                }
                if (fields == null) break;

                if (fields.length != header.length) {
                    if (isBlankLine(fields)) continue;
                    malformed++;
                    log.debug("{} line {}: expected {} fields, found {}",
                            kind, reader.getLinesRead(), header.length, fields.length);
                    continue;
                }
                batch.add(schema.adapt(toMap(header, fields)));

                if (batch.size() >= batchSize) {
                    delivered += batch.size();
                    keepGoing = consumer.test(batch);
                    batch = new ArrayList<>(Math.min(batchSize, 10_000));
                    log.info("  {} rows read so far: {}", kind, delivered);
                }
            }

            if (keepGoing && !batch.isEmpty()) {
                delivered += batch.size();
                consumer.test(batch);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading " + file, e);
        }

        log.info("{}: read {} rows from {}, {} malformed lines skipped", kind, delivered, file, malformed);
        return delivered;
    }

    private static String[] readHeader(CSVReader reader, Path file) throws IOException {
        try {
            return reader.readNext();
        } catch (CsvValidationException e) {
            throw new IOException("Unreadable header in " + file, e);
        }
    }

    private static Map<String, String> toMap(String[] header, String[] fields) {
        Map<String, String> row = new LinkedHashMap<>(header.length * 2);
        for (int i = 0; i < header.length; i++) {
            row.put(header[i], fields[i]);
        }
        return row;
    }

    private static boolean isBlankLine(String[] fields) {
        return fields.length == 1 && fields[0].isBlank();
    }

    private static Reader open(Path file) throws IOException {
        try {
            return Files.newBufferedReader(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new NoSuchFileException(file.toString(), null,
                    "export not found; download it from data.transportation.gov and set its path in the config");
        }
    }
}
