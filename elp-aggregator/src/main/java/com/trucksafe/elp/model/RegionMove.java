package com.trucksafe.elp.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One region's OOS change between the two reference months.
 * {@code change} is a percentage rounded to one decimal.
 */
@JsonPropertyOrder({"state", "current", "previous", "change"})
public record RegionMove(@JsonProperty("state") String state,
                         @JsonProperty("current") int current,
                         @JsonProperty("previous") int previous,
                         @JsonProperty("change") double change) {}
