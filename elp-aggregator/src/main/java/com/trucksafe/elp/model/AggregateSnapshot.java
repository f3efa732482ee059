package com.trucksafe.elp.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * The single artifact the dashboard reads (elp_data.json).
 *
 * Field names and types are a compatibility contract with the dashboard's
 * JavaScript. Do not rename without changing the front end.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
        "last_updated", "total_oos", "total_all", "oos_rate", "avg_per_month",
        "peak_month", "peak_count", "mom_change", "monthly", "states",
        "state_monthly", "biggest_movers", "state_count", "data_source"
})
public class AggregateSnapshot {

    public static final String SOURCE_REAL = "real";
    public static final String SOURCE_SAMPLE = "sample";

    /** e.g. "October 19, 2026" */
    @JsonProperty("last_updated")
    String lastUpdated;

    @JsonProperty("total_oos")
    int totalOos;

    @JsonProperty("total_all")
    int totalAll;

    /** Percentage, one decimal */
    @JsonProperty("oos_rate")
    double oosRate;

    @JsonProperty("avg_per_month")
    long avgPerMonth;

    /** e.g. "Oct '25", or "N/A" with no data */
    @JsonProperty("peak_month")
    String peakMonth;

    @JsonProperty("peak_count")
    int peakCount;

    @JsonProperty("mom_change")
    double momChange;

    @JsonProperty("monthly")
    MonthlySeries monthly;

    @JsonProperty("states")
    List<RegionCount> states;

    /** region → month label → counts; absent in the bundled sample */
    @JsonProperty("state_monthly")
    Map<String, Map<String, BucketCount>> stateMonthly;

    @JsonProperty("biggest_movers")
    BiggestMovers biggestMovers;

    /** Regions with at least one OOS violation */
    @JsonProperty("state_count")
    int stateCount;

    @JsonProperty("data_source")
    String dataSource;
}
