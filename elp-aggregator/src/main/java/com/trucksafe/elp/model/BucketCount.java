package com.trucksafe.elp.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Frozen {oos, all} pair for one monthly, region or region×month bucket.
 */
@JsonPropertyOrder({"oos", "all"})
public record BucketCount(@JsonProperty("oos") int oos, @JsonProperty("all") int all) {

    public static final BucketCount EMPTY = new BucketCount(0, 0);

    public BucketCount {
        if (oos < 0 || all < 0) {
            throw new IllegalArgumentException("Bucket counts cannot be negative: oos=" + oos + ", all=" + all);
        }
        if (oos > all) {
            throw new IllegalArgumentException("OOS count " + oos + " exceeds total " + all);
        }
    }
}
