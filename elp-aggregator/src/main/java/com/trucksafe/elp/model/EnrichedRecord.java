package com.trucksafe.elp.model;

import java.time.YearMonth;

/**
 * A matched violation with the region resolved from its inspection.
 * {@code month} is the bucket the record is counted in; it is the violation's
 * month unless the pipeline is configured to bucket by inspection date.
 */
public record EnrichedRecord(NormalizedViolation violation, String region, YearMonth month) {

    public EnrichedRecord(NormalizedViolation violation, String region) {
        this(violation, region, violation.month());
    }

    public boolean outOfService() {
        return violation.outOfService();
    }
}
