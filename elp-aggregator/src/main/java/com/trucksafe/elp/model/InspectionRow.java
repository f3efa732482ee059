package com.trucksafe.elp.model;

import lombok.Builder;
import lombok.Data;

/**
 * Canonical inspection row. Only the fields the join needs are kept.
 */
@Data
@Builder
public class InspectionRow {

    private String inspectionId;

    /** Two-letter report state, e.g. "CA" */
    private String region;

    private String rawDate;
}
