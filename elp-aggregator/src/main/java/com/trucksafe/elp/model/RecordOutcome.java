package com.trucksafe.elp.model;

import java.util.Objects;

/**
 * Result of normalizing one violation row: either the normalized violation
 * or the reason it was left out. Exactly one of the two is non-null.
 */
public record RecordOutcome(NormalizedViolation violation, ExclusionReason reason) {

    public RecordOutcome {
        if ((violation == null) == (reason == null)) {
            throw new IllegalArgumentException("Exactly one of violation or reason must be set");
        }
    }

    public static RecordOutcome matched(NormalizedViolation violation) {
        return new RecordOutcome(Objects.requireNonNull(violation), null);
    }

    public static RecordOutcome excluded(ExclusionReason reason) {
        return new RecordOutcome(null, Objects.requireNonNull(reason));
    }

    public boolean isMatched() {
        return violation != null;
    }
}
