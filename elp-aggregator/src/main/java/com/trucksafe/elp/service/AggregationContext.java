package com.trucksafe.elp.service;

import com.trucksafe.elp.model.BucketCount;
import com.trucksafe.elp.model.CountTables;
import com.trucksafe.elp.model.EnrichedRecord;

import java.time.YearMonth;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Owns the count tables for one run: per month, per region and per
 * region × month, each holding {oos, all}.
 *
 * Buckets appear on first sight of a key and are only ever incremented, so
 * the frozen tables are the same whatever order records arrive in. Writers
 * are serialized on this object's monitor; callers may feed it from a
 * parallel stream.
 */
public class AggregationContext {

    private final Map<YearMonth, Tally> monthly = new HashMap<>();
    private final Map<String, Tally> regions = new HashMap<>();
    private final Map<String, Map<YearMonth, Tally>> regionMonthly = new HashMap<>();
    private int totalOos;
    private int totalAll;
    private boolean frozen;

    public synchronized void add(EnrichedRecord record) {
        if (frozen) {
            throw new IllegalStateException("Aggregation context is frozen");
        }
        boolean oos = record.outOfService();
        YearMonth month = record.month();
        String region = record.region();

        monthly.computeIfAbsent(month, m -> new Tally()).count(oos);
        regions.computeIfAbsent(region, r -> new Tally()).count(oos);
        regionMonthly.computeIfAbsent(region, r -> new HashMap<>())
                .computeIfAbsent(month, m -> new Tally())
                .count(oos);

        totalAll++;
        if (oos) totalOos++;
    }

    public void addAll(Collection<EnrichedRecord> records) {
        records.parallelStream().forEach(this::add);
    }

    public synchronized int size() {
        return totalAll;
    }

    /** Stop accepting records and return immutable, sorted copies of the tables. */
    public synchronized CountTables freeze() {
        frozen = true;

        SortedMap<YearMonth, BucketCount> frozenMonthly = new TreeMap<>();
        monthly.forEach((m, t) -> frozenMonthly.put(m, t.toBucket()));

        SortedMap<String, BucketCount> frozenRegions = new TreeMap<>();
        regions.forEach((r, t) -> frozenRegions.put(r, t.toBucket()));

        SortedMap<String, SortedMap<YearMonth, BucketCount>> frozenRegionMonthly = new TreeMap<>();
        regionMonthly.forEach((r, months) -> {
            SortedMap<YearMonth, BucketCount> cells = new TreeMap<>();
            months.forEach((m, t) -> cells.put(m, t.toBucket()));
            frozenRegionMonthly.put(r, cells);
        });

        return new CountTables(frozenMonthly, frozenRegions, frozenRegionMonthly, totalOos, totalAll);
    }

    private static final class Tally {
        private int oos;
        private int all;

        void count(boolean outOfService) {
            all++;
            if (outOfService) oos++;
        }

        BucketCount toBucket() {
            return new BucketCount(oos, all);
        }
    }
}
