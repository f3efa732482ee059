package com.trucksafe.elp.model;

import java.time.YearMonth;
import java.util.Collections;
import java.util.SortedMap;

/**
 * The three count tables frozen at the end of aggregation.
 *
 * All maps are unmodifiable and sorted: months ascending, regions by code.
 */
public record CountTables(SortedMap<YearMonth, BucketCount> monthly,
                          SortedMap<String, BucketCount> regions,
                          SortedMap<String, SortedMap<YearMonth, BucketCount>> regionMonthly,
                          int totalOos,
                          int totalAll) {

    public CountTables {
        monthly = Collections.unmodifiableSortedMap(monthly);
        regions = Collections.unmodifiableSortedMap(regions);
        regionMonthly = Collections.unmodifiableSortedMap(regionMonthly);
    }

    public boolean isEmpty() {
        return totalAll == 0;
    }

    /** Cell for a region and month; EMPTY when the region had nothing that month. */
    public BucketCount cell(String region, YearMonth month) {
        SortedMap<YearMonth, BucketCount> months = regionMonthly.get(region);
        if (months == null) return BucketCount.EMPTY;
        return months.getOrDefault(month, BucketCount.EMPTY);
    }
}
