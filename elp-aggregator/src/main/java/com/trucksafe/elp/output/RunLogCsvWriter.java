package com.trucksafe.elp.output;

import com.opencsv.CSVWriter;
import com.trucksafe.elp.model.ExclusionReason;
import com.trucksafe.elp.model.PipelineRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Appends one line per run to a CSV file, writing the header when the file
 * is new. Exclusion counts get one column per reason.
 */
@Component
@Slf4j
public class RunLogCsvWriter {

    private static final String[] BASE_HEADERS = {
            "run_id", "source", "status",
            "started_at", "completed_at",
            "violations_scanned", "violations_matched",
            "inspections_scanned", "records_aggregated",
            "output_path", "error_message"
    };

    public void append(PipelineRun run, Path logFile) {
        boolean newFile = !Files.exists(logFile);
        ensureDirectory(logFile.toAbsolutePath().getParent());

        try (Writer out = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (newFile) {
                writer.writeNext(headers());
            }
            writer.writeNext(toRow(run));
            log.debug("Appended run {} to {}", run.getRunId(), logFile);

        } catch (IOException e) {
            throw new UncheckedIOException("Run log write failed: " + logFile, e);
        }
    }

    static String[] headers() {
        List<String> headers = new ArrayList<>(List.of(BASE_HEADERS));
        for (ExclusionReason reason : ExclusionReason.values()) {
            headers.add("excluded_" + reason.name().toLowerCase(Locale.ROOT));
        }
        return headers.toArray(new String[0]);
    }

    private String[] toRow(PipelineRun r) {
        List<String> row = new ArrayList<>(List.of(
                str(r.getRunId()),
                str(r.getSourceName()),
                str(r.getStatus()),
                str(r.getStartedAt()),
                str(r.getCompletedAt()),
                str(r.getViolationsScanned()),
                str(r.getViolationsMatched()),
                str(r.getInspectionsScanned()),
                str(r.getRecordsAggregated()),
                str(r.getOutputPath()),
                str(r.getErrorMessage())));
        for (ExclusionReason reason : ExclusionReason.values()) {
            row.add(str(r.excluded(reason)));
        }
        return row.toArray(new String[0]);
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create run log directory: " + dir, e);
        }
    }
}
