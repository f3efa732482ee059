package com.trucksafe.elp.service;

import com.trucksafe.elp.model.BucketCount;
import com.trucksafe.elp.model.CountTables;
import com.trucksafe.elp.model.EnrichedRecord;
import com.trucksafe.elp.model.NormalizedViolation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregationContextTest {

    private static final YearMonth JUNE = YearMonth.of(2025, 6);
    private static final YearMonth JULY = YearMonth.of(2025, 7);

    private static EnrichedRecord record(String id, String region, YearMonth month, boolean oos) {
        return new EnrichedRecord(new NormalizedViolation(id, month, true, oos), region);
    }

    @Test
    @DisplayName("each record counts once in its month, its region and its region-month cell")
    void countsEachRecordInAllThreeTables() {
        AggregationContext context = new AggregationContext();
        context.add(record("1", "CA", JUNE, true));
        context.add(record("2", "CA", JUNE, false));
        context.add(record("3", "TX", JULY, true));

        CountTables tables = context.freeze();

        assertThat(tables.totalAll()).isEqualTo(3);
        assertThat(tables.totalOos()).isEqualTo(2);
        assertThat(tables.monthly()).containsExactly(
                Map.entry(JUNE, new BucketCount(1, 2)),
                Map.entry(JULY, new BucketCount(1, 1)));
        assertThat(tables.regions()).containsExactly(
                Map.entry("CA", new BucketCount(1, 2)),
                Map.entry("TX", new BucketCount(1, 1)));
        assertThat(tables.cell("CA", JUNE)).isEqualTo(new BucketCount(1, 2));
        assertThat(tables.cell("CA", JULY)).isEqualTo(BucketCount.EMPTY);
        assertThat(tables.cell("NV", JUNE)).isEqualTo(BucketCount.EMPTY);
    }

    @Test
    @DisplayName("an empty context freezes to empty tables")
    void emptyContext() {
        CountTables tables = new AggregationContext().freeze();

        assertThat(tables.isEmpty()).isTrue();
        assertThat(tables.monthly()).isEmpty();
        assertThat(tables.regions()).isEmpty();
    }

    @Test
    @DisplayName("oos never exceeds all in any bucket")
    void oosBoundedByTotal() {
        AggregationContext context = new AggregationContext();
        context.addAll(randomRecords(2_000, new Random(7)));
        CountTables tables = context.freeze();

        assertThat(tables.monthly().values()).allSatisfy(c -> assertThat(c.oos()).isLessThanOrEqualTo(c.all()));
        assertThat(tables.regions().values()).allSatisfy(c -> assertThat(c.oos()).isLessThanOrEqualTo(c.all()));
        tables.regionMonthly().values().forEach(cells ->
                assertThat(cells.values()).allSatisfy(c -> assertThat(c.oos()).isLessThanOrEqualTo(c.all())));
    }

    @Test
    @DisplayName("region-month cells sum to both the monthly and the region totals")
    void tablesAreConsistent() {
        AggregationContext context = new AggregationContext();
        context.addAll(randomRecords(1_000, new Random(11)));
        CountTables tables = context.freeze();

        tables.regions().forEach((region, total) -> {
            int all = tables.regionMonthly().get(region).values().stream().mapToInt(BucketCount::all).sum();
            int oos = tables.regionMonthly().get(region).values().stream().mapToInt(BucketCount::oos).sum();
            assertThat(new BucketCount(oos, all)).isEqualTo(total);
        });
        tables.monthly().forEach((month, total) -> {
            int all = tables.regions().keySet().stream().mapToInt(r -> tables.cell(r, month).all()).sum();
            assertThat(all).isEqualTo(total.all());
        });
    }

    @Test
    @DisplayName("parallel delivery in any order freezes to identical tables")
    void orderIndependent() {
        List<EnrichedRecord> records = randomRecords(5_000, new Random(42));

        AggregationContext sequential = new AggregationContext();
        records.forEach(sequential::add);
        CountTables expected = sequential.freeze();

        for (int seed = 0; seed < 5; seed++) {
            List<EnrichedRecord> shuffled = new ArrayList<>(records);
            Collections.shuffle(shuffled, new Random(seed));
            AggregationContext parallel = new AggregationContext();
            parallel.addAll(shuffled);

            assertThat(parallel.freeze()).isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("a frozen context refuses further records")
    void frozenRejectsAdds() {
        AggregationContext context = new AggregationContext();
        context.freeze();

        assertThatThrownBy(() -> context.add(record("1", "CA", JUNE, true)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("bucket counts reject oos above all")
    void bucketInvariant() {
        assertThatThrownBy(() -> new BucketCount(2, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BucketCount(-1, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    private static List<EnrichedRecord> randomRecords(int n, Random random) {
        String[] regions = {"CA", "TX", "FL", "NY", "AZ", "NV"};
        List<EnrichedRecord> records = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            records.add(record(
                    String.valueOf(i),
                    regions[random.nextInt(regions.length)],
                    YearMonth.of(2025, 1 + random.nextInt(12)),
                    random.nextBoolean()));
        }
        return records;
    }
}
