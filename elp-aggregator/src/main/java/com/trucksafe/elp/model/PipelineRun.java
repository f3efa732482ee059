package com.trucksafe.elp.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * Diagnostics for one aggregation run. Logged at the end of the run and,
 * when configured, appended to the run log CSV.
 */
@Data
@Builder
public class PipelineRun {

    private String runId;           // UUID
    private String sourceName;      // csv | api
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Status status;
    private int violationsScanned;
    private int violationsMatched;
    private int inspectionsScanned;
    private int recordsAggregated;
    private String outputPath;      // null when nothing was written
    private String errorMessage;    // null on success

    @Builder.Default
    private Map<ExclusionReason, Integer> exclusions = new EnumMap<>(ExclusionReason.class);

    public void exclude(ExclusionReason reason, int count) {
        if (count > 0) {
            exclusions.merge(reason, count, Integer::sum);
        }
    }

    public int excluded(ExclusionReason reason) {
        return exclusions.getOrDefault(reason, 0);
    }

    public enum Status {
        RUNNING, SUCCESS, EMPTY, FAILED
    }
}
