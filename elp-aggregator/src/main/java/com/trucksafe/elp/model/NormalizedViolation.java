package com.trucksafe.elp.model;

import java.time.YearMonth;

/**
 * A violation row after classification and date normalization.
 */
public record NormalizedViolation(String inspectionId,
                                  YearMonth month,
                                  boolean targetCategory,
                                  boolean outOfService) {}
