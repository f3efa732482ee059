package com.trucksafe.elp.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"state", "oos", "all"})
public record RegionCount(@JsonProperty("state") String state,
                          @JsonProperty("oos") int oos,
                          @JsonProperty("all") int all) {}
