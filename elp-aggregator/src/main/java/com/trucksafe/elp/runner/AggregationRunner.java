package com.trucksafe.elp.runner;

import com.trucksafe.elp.config.ElpAggregatorProperties;
import com.trucksafe.elp.model.PipelineRun;
import com.trucksafe.elp.service.ElpAggregationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline once at startup and turns the outcome into the process
 * exit code: 0 when a snapshot was written, 1 otherwise.
 *
 * Set {@code elp-aggregator.run-on-startup=false} to start the context
 * without running (tests, dry configuration checks).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AggregationRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    private final ElpAggregationService aggregationService;
    private final ElpAggregatorProperties properties;

    private int exitCode = EXIT_OK;

    @Override
    public void run(String... args) {
        if (!properties.isRunOnStartup()) {
            log.info("Aggregator ready, run-on-startup disabled");
            return;
        }

        log.info("Starting ELP aggregation (source: {}, analysis from {})",
                properties.getSource().getMode(), properties.getAnalysis().getStartYear());
        PipelineRun run = aggregationService.run();
        exitCode = exitCodeFor(run);

        if (exitCode == EXIT_OK) {
            log.info("Data pipeline completed, snapshot at {}", run.getOutputPath());
        } else {
            log.error("Data pipeline did not produce a snapshot (status {})", run.getStatus());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static int exitCodeFor(PipelineRun run) {
        return switch (run.getStatus()) {
            case SUCCESS -> EXIT_OK;
            case EMPTY -> run.getOutputPath() != null ? EXIT_OK : EXIT_FAILED;
            case RUNNING, FAILED -> EXIT_FAILED;
        };
    }
}
