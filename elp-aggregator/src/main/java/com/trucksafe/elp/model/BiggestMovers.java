package com.trucksafe.elp.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"increases", "decreases"})
public record BiggestMovers(@JsonProperty("increases") List<RegionMove> increases,
                            @JsonProperty("decreases") List<RegionMove> decreases) {

    public static final BiggestMovers NONE = new BiggestMovers(List.of(), List.of());

    public BiggestMovers {
        increases = List.copyOf(increases);
        decreases = List.copyOf(decreases);
    }
}
