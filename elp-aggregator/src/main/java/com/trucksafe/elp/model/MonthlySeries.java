package com.trucksafe.elp.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Parallel arrays for the dashboard's monthly chart, oldest month first.
 */
@JsonPropertyOrder({"labels", "oos", "all"})
public record MonthlySeries(@JsonProperty("labels") List<String> labels,
                            @JsonProperty("oos") List<Integer> oos,
                            @JsonProperty("all") List<Integer> all) {

    public MonthlySeries {
        labels = List.copyOf(labels);
        oos = List.copyOf(oos);
        all = List.copyOf(all);
        if (labels.size() != oos.size() || labels.size() != all.size()) {
            throw new IllegalArgumentException("Monthly series arrays must have equal length");
        }
    }
}
