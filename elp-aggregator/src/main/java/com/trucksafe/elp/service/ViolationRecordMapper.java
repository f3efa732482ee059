package com.trucksafe.elp.service;

import com.trucksafe.elp.config.ElpAggregatorProperties;
import com.trucksafe.elp.model.ExclusionReason;
import com.trucksafe.elp.model.NormalizedViolation;
import com.trucksafe.elp.model.RecordOutcome;
import com.trucksafe.elp.model.ViolationRow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.util.Optional;

/**
 * Maps a canonical violation row to a {@link RecordOutcome}.
 *
 * Checks run cheapest first: identifier, category, date, analysis window.
 * Stateless and safe to call from parallel streams.
 */
@Component
@RequiredArgsConstructor
public class ViolationRecordMapper {

    private final ViolationClassifier classifier;
    private final DateNormalizer dateNormalizer;
    private final ElpAggregatorProperties properties;

    public RecordOutcome map(ViolationRow row) {
        if (row == null || isBlank(row.getInspectionId())) {
            return RecordOutcome.excluded(ExclusionReason.MISSING_IDENTIFIER);
        }
        if (!classifier.isTargetCategory(row)) {
            return RecordOutcome.excluded(ExclusionReason.NOT_TARGET_CATEGORY);
        }

        Optional<YearMonth> month = dateNormalizer.normalize(row.getRawDate());
        if (month.isEmpty()) {
            return RecordOutcome.excluded(ExclusionReason.UNPARSEABLE_DATE);
        }
        if (!withinAnalysisWindow(month.get())) {
            return RecordOutcome.excluded(ExclusionReason.BEFORE_ANALYSIS_START);
        }

        return RecordOutcome.matched(new NormalizedViolation(
                row.getInspectionId().trim(),
                month.get(),
                true,
                classifier.isOutOfService(row)));
    }

    /** True when the month is on or after January of the configured start year. */
    public boolean withinAnalysisWindow(YearMonth month) {
        return month.getYear() >= properties.getAnalysis().getStartYear();
    }

    private static boolean isBlank(String val) {
        return val == null || val.isBlank();
    }
}
