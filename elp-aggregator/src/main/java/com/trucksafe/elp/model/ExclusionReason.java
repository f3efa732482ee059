package com.trucksafe.elp.model;

/**
 * Why a record did not reach the aggregates.
 */
public enum ExclusionReason {
    MISSING_IDENTIFIER,
    NOT_TARGET_CATEGORY,
    UNPARSEABLE_DATE,
    BEFORE_ANALYSIS_START,
    DUPLICATE_IDENTIFIER,
    UNMATCHED_IDENTIFIER,
    UNPARSEABLE_INSPECTION_DATE
}
