package com.trucksafe.elp.service;

import com.trucksafe.elp.config.ElpAggregatorProperties;
import com.trucksafe.elp.config.ElpAggregatorProperties.Analysis.DuplicatePolicy;
import com.trucksafe.elp.model.AggregateSnapshot;
import com.trucksafe.elp.model.CountTables;
import com.trucksafe.elp.model.EnrichedRecord;
import com.trucksafe.elp.model.ExclusionReason;
import com.trucksafe.elp.model.NormalizedViolation;
import com.trucksafe.elp.model.PipelineRun;
import com.trucksafe.elp.model.RecordOutcome;
import com.trucksafe.elp.model.ViolationRow;
import com.trucksafe.elp.output.OutputRouter;
import com.trucksafe.elp.output.SampleSnapshotLoader;
import com.trucksafe.elp.source.RecordSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs one aggregation: classify violations, join them to inspections,
 * count, derive statistics and hand the snapshot to the output.
 *
 * Violations are classified batch by batch as the source streams them, and
 * only matched rows are kept. Each later stage consumes its whole input
 * before the next starts. Row classification runs on a parallel stream;
 * everything that depends on row order (duplicate handling, the join's
 * last-seen rule) runs sequentially.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ElpAggregationService {

    private final RecordSource source;
    private final ViolationRecordMapper mapper;
    private final DateNormalizer dateNormalizer;
    private final StatisticsEngine statistics;
    private final OutputRouter outputRouter;
    private final SampleSnapshotLoader sampleLoader;
    private final ElpAggregatorProperties properties;
    private final Clock clock;

    /**
     * Full run, including output. Never throws; the outcome is in the
     * returned run's status.
     */
    public PipelineRun run() {
        PipelineRun run = PipelineRun.builder()
                .runId(UUID.randomUUID().toString())
                .sourceName(source.name())
                .startedAt(LocalDateTime.now(clock))
                .status(PipelineRun.Status.RUNNING)
                .build();

        try {
            CountTables tables = aggregate(run);

            if (tables.isEmpty()) {
                handleEmpty(run);
            } else {
                AggregateSnapshot snapshot = statistics.summarize(tables);
                Path written = outputRouter.writeSnapshot(snapshot);
                run.setOutputPath(written.toString());
                run.setStatus(PipelineRun.Status.SUCCESS);
            }

        } catch (RuntimeException e) {
            log.error("Aggregation run failed: {}", e.getMessage(), e);
            run.setStatus(PipelineRun.Status.FAILED);
            run.setErrorMessage(e.getMessage());
        } finally {
            run.setCompletedAt(LocalDateTime.now(clock));
            logSummary(run);
            outputRouter.writeRun(run);
        }
        return run;
    }

    /**
     * Classify, deduplicate, join and count. Diagnostics are recorded on {@code run}.
     */
    public CountTables aggregate(PipelineRun run) {
        // ── Classify ─────────────────────────────────────────────────────────
        List<NormalizedViolation> matched = new ArrayList<>();
        int scanned = source.forEachViolationBatch(batch -> classify(batch, matched, run));
        run.setViolationsScanned(scanned);

        List<NormalizedViolation> violations = deduplicate(matched, run);
        run.setViolationsMatched(violations.size());
        log.info("Classified {} violation rows: {} ELP violations in scope ({} rows before de-duplication)",
                scanned, violations.size(), matched.size());

        // ── Join ─────────────────────────────────────────────────────────────
        Set<String> wanted = violations.stream()
                .map(NormalizedViolation::inspectionId)
                .collect(Collectors.toSet());

        InspectionJoinEngine join = new InspectionJoinEngine(
                wanted,
                properties.getAnalysis().getMonthSource(),
                dateNormalizer,
                mapper::withinAnalysisWindow);

        if (!wanted.isEmpty()) {
            run.setInspectionsScanned(source.forEachInspectionBatch(join::accept));
        }
        log.info("Resolved a state for {} of {} inspections ({} inspection rows scanned, {} without a state)",
                join.resolvedCount(), wanted.size(), join.rowsSeen(), join.rowsWithoutRegion());

        List<EnrichedRecord> enriched = new ArrayList<>(violations.size());
        for (NormalizedViolation violation : violations) {
            InspectionJoinEngine.JoinOutcome outcome = join.enrich(violation);
            if (outcome.isJoined()) {
                enriched.add(outcome.record());
            } else {
                run.exclude(outcome.reason(), 1);
            }
        }

        // ── Aggregate ────────────────────────────────────────────────────────
        AggregationContext context = new AggregationContext();
        context.addAll(enriched);
        CountTables tables = context.freeze();
        run.setRecordsAggregated(tables.totalAll());

        log.info("Aggregated {} violations ({} OOS) across {} months and {} states",
                tables.totalAll(), tables.totalOos(), tables.monthly().size(), tables.regions().size());
        return tables;
    }

    /**
     * Classify one batch of raw rows and keep only the matched violations, so
     * memory follows the matched rows rather than the size of the export.
     * Encounter order is preserved for the duplicate policy.
     */
    private void classify(List<ViolationRow> batch, List<NormalizedViolation> matched, PipelineRun run) {
        List<RecordOutcome> outcomes = batch.parallelStream()
                .map(mapper::map)
                .toList();

        for (RecordOutcome outcome : outcomes) {
            if (outcome.isMatched()) {
                matched.add(outcome.violation());
            } else {
                run.exclude(outcome.reason(), 1);
            }
        }
    }

    /**
     * Apply the configured duplicate policy to matched violations sharing an
     * inspection id. Keeps the encounter order of each id's first appearance.
     */
    List<NormalizedViolation> deduplicate(List<NormalizedViolation> matched, PipelineRun run) {
        DuplicatePolicy policy = properties.getAnalysis().getDuplicatePolicy();
        if (policy == DuplicatePolicy.KEEP_ALL) {
            return matched;
        }

        Map<String, NormalizedViolation> byId = new LinkedHashMap<>();
        for (NormalizedViolation v : matched) {
            if (policy == DuplicatePolicy.LAST_SEEN) {
                byId.put(v.inspectionId(), v);
            } else {
                byId.putIfAbsent(v.inspectionId(), v);
            }
        }
        run.exclude(ExclusionReason.DUPLICATE_IDENTIFIER, matched.size() - byId.size());
        return new ArrayList<>(byId.values());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void handleEmpty(PipelineRun run) {
        run.setStatus(PipelineRun.Status.EMPTY);

        if (!properties.getOutput().isFallbackToSample()) {
            log.error("No ELP violations matched an inspection; not writing {}", properties.getOutput().getPath());
            return;
        }

        log.warn("No ELP violations matched; writing representative sample data instead");
        AggregateSnapshot sample = sampleLoader.load();
        Path written = outputRouter.writeSnapshot(sample);
        run.setOutputPath(written.toString());
    }

    private void logSummary(PipelineRun run) {
        log.info("Run {} finished with status {}: {} violation rows scanned, {} in scope, {} aggregated",
                run.getRunId(), run.getStatus(), run.getViolationsScanned(),
                run.getViolationsMatched(), run.getRecordsAggregated());
        run.getExclusions().forEach((reason, count) ->
                log.info("  excluded {}: {}", reason, count));
    }
}
