package com.trucksafe.elp.output;

import com.trucksafe.elp.config.ElpAggregatorProperties;
import com.trucksafe.elp.model.AggregateSnapshot;
import com.trucksafe.elp.model.PipelineRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Routes the snapshot and the run record to their configured destinations.
 * The snapshot is mandatory; the run log is optional metadata and failures
 * there only warn.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final SnapshotWriter snapshotWriter;
    private final RunLogCsvWriter runLogWriter;
    private final ElpAggregatorProperties properties;

    public Path writeSnapshot(AggregateSnapshot snapshot) {
        return snapshotWriter.write(snapshot, Paths.get(properties.getOutput().getPath()));
    }

    public void writeRun(PipelineRun run) {
        String runLog = properties.getOutput().getRunLogPath();
        if (runLog == null || runLog.isBlank()) return;

        try {
            runLogWriter.append(run, Paths.get(runLog));
        } catch (Exception e) {
            log.warn("Failed to write run metadata: {}", e.getMessage());
        }
    }
}
