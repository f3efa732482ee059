package com.trucksafe.elp.model;

import lombok.Builder;
import lombok.Data;

/**
 * Canonical violation row, produced by a schema adapter from whatever shape
 * the upstream extract or API page used.
 *
 * Every field is raw text and may be null. Nothing is validated here.
 */
@Data
@Builder
public class ViolationRow {

    /** Inspection this violation was cited on; the join key. */
    private String inspectionId;

    /** CFR part, e.g. "391" */
    private String partNumber;

    /** Section within the part, e.g. "11(B)(2)" or "11B2-S" */
    private String section;

    /** Free-text section description, when the schema carries one */
    private String description;

    /** Date text in any of the encodings DateNormalizer understands */
    private String rawDate;

    /** Out-of-service indicator as delivered: Y, TRUE, 1, ... */
    private String rawOosIndicator;
}
