package com.trucksafe.elp.service;

import com.trucksafe.elp.config.ElpAggregatorProperties.Analysis.MonthSource;
import com.trucksafe.elp.model.EnrichedRecord;
import com.trucksafe.elp.model.ExclusionReason;
import com.trucksafe.elp.model.InspectionRow;
import com.trucksafe.elp.model.NormalizedViolation;

import java.time.YearMonth;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Resolves violation inspection ids to the state the inspection was reported in.
 *
 * Inspection rows arrive in batches (file chunks or API pages). Only ids
 * listed in {@code wantedIds} are indexed, which keeps memory proportional to
 * the matched violations rather than to the inspection file.
 *
 * When an id is seen more than once with different states, the most recently
 * observed row wins. This is a tie-break, not a claim that the later row is
 * right. Once every wanted id is resolved, {@link #accept} returns false so the
 * source can stop early; later duplicates are then never seen.
 *
 * One instance per run; not thread-safe.
 */
public class InspectionJoinEngine {

    private final Set<String> wantedIds;
    private final MonthSource monthSource;
    private final DateNormalizer dateNormalizer;
    private final Predicate<YearMonth> analysisWindow;

    private final Map<String, InspectionRow> index = new HashMap<>();
    private int rowsSeen;
    private int rowsWithoutRegion;

    public InspectionJoinEngine(Set<String> wantedIds,
                                MonthSource monthSource,
                                DateNormalizer dateNormalizer,
                                Predicate<YearMonth> analysisWindow) {
        this.wantedIds = Set.copyOf(wantedIds);
        this.monthSource = monthSource;
        this.dateNormalizer = dateNormalizer;
        this.analysisWindow = analysisWindow;
    }

    /**
     * Index one batch.
     *
     * @return true if more batches are wanted, false once every wanted id is resolved
     */
    public boolean accept(List<InspectionRow> batch) {
        for (InspectionRow row : batch) {
            rowsSeen++;
            String id = trimToNull(row.getInspectionId());
            if (id == null || !wantedIds.contains(id)) continue;

            String region = trimToNull(row.getRegion());
            if (region == null) {
                rowsWithoutRegion++;
                continue;
            }
            index.put(id, InspectionRow.builder()
                    .inspectionId(id)
                    .region(region.toUpperCase(Locale.ROOT))
                    .rawDate(row.getRawDate())
                    .build());
        }
        return !isSatisfied();
    }

    public boolean isSatisfied() {
        return index.size() >= wantedIds.size();
    }

    public Optional<String> regionOf(String inspectionId) {
        InspectionRow row = index.get(inspectionId);
        return row == null ? Optional.empty() : Optional.of(row.getRegion());
    }

    /**
     * Attach the resolved region, and with {@link MonthSource#INSPECTION} the
     * inspection's own month, to a matched violation.
     */
    public JoinOutcome enrich(NormalizedViolation violation) {
        InspectionRow inspection = index.get(violation.inspectionId());
        if (inspection == null) {
            return JoinOutcome.dropped(ExclusionReason.UNMATCHED_IDENTIFIER);
        }
        if (monthSource == MonthSource.VIOLATION) {
            return JoinOutcome.joined(new EnrichedRecord(violation, inspection.getRegion()));
        }

        Optional<YearMonth> month = dateNormalizer.normalize(inspection.getRawDate());
        if (month.isEmpty()) {
            return JoinOutcome.dropped(ExclusionReason.UNPARSEABLE_INSPECTION_DATE);
        }
        if (!analysisWindow.test(month.get())) {
            return JoinOutcome.dropped(ExclusionReason.BEFORE_ANALYSIS_START);
        }
        return JoinOutcome.joined(new EnrichedRecord(violation, inspection.getRegion(), month.get()));
    }

    public int resolvedCount() {
        return index.size();
    }

    public int rowsSeen() {
        return rowsSeen;
    }

    public int rowsWithoutRegion() {
        return rowsWithoutRegion;
    }

    private static String trimToNull(String val) {
        if (val == null) return null;
        String t = val.trim();
        return t.isEmpty() ? null : t;
    }

    /** Either an enriched record or the reason the violation was dropped. */
    public record JoinOutcome(EnrichedRecord record, ExclusionReason reason) {

        static JoinOutcome joined(EnrichedRecord record) {
            return new JoinOutcome(record, null);
        }

        static JoinOutcome dropped(ExclusionReason reason) {
            return new JoinOutcome(null, reason);
        }

        public boolean isJoined() {
            return record != null;
        }
    }
}
