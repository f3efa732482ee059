package com.trucksafe.elp.service;

import com.trucksafe.elp.config.ElpAggregatorProperties;
import com.trucksafe.elp.model.AggregateSnapshot;
import com.trucksafe.elp.model.BiggestMovers;
import com.trucksafe.elp.model.BucketCount;
import com.trucksafe.elp.model.CountTables;
import com.trucksafe.elp.model.MonthlySeries;
import com.trucksafe.elp.model.RegionCount;
import com.trucksafe.elp.model.RegionMove;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;

/**
 * Derives the dashboard figures from frozen count tables.
 *
 * The most recent month in the data is usually still filling up, so
 * month-over-month figures compare the two months before it. Percentages are
 * rounded half-even on the exact double value, one decimal.
 */
@Component
@RequiredArgsConstructor
public class StatisticsEngine {

    static final String NO_PEAK = "N/A";

    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("MMM yy", Locale.US);
    private static final DateTimeFormatter PEAK_LABEL = DateTimeFormatter.ofPattern("MMM ''yy", Locale.US);
    private static final DateTimeFormatter UPDATED_LABEL = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.US);

    private static final Comparator<RegionMove> BY_CHANGE_DESC =
            Comparator.<RegionMove>comparingDouble(StatisticsEngine::rawChange).reversed()
                    .thenComparing(RegionMove::state);
    private static final Comparator<RegionMove> BY_CHANGE_ASC =
            Comparator.<RegionMove>comparingDouble(StatisticsEngine::rawChange)
                    .thenComparing(RegionMove::state);

    private final ElpAggregatorProperties properties;
    private final Clock clock;

    public AggregateSnapshot summarize(CountTables tables) {
        List<YearMonth> months = new ArrayList<>(tables.monthly().keySet());

        List<String> labels = new ArrayList<>(months.size());
        List<Integer> oos = new ArrayList<>(months.size());
        List<Integer> all = new ArrayList<>(months.size());
        for (YearMonth month : months) {
            BucketCount count = tables.monthly().get(month);
            labels.add(monthLabel(month));
            oos.add(count.oos());
            all.add(count.all());
        }

        Map.Entry<YearMonth, BucketCount> peak = peakMonth(tables.monthly());

        return AggregateSnapshot.builder()
                .lastUpdated(LocalDate.now(clock).format(UPDATED_LABEL))
                .totalOos(tables.totalOos())
                .totalAll(tables.totalAll())
                .oosRate(oosRate(tables.totalOos(), tables.totalAll()))
                .avgPerMonth(averagePerMonth(tables.totalOos(), months.size()))
                .peakMonth(peak == null ? NO_PEAK : peak.getKey().format(PEAK_LABEL))
                .peakCount(peak == null ? 0 : peak.getValue().oos())
                .momChange(monthOverMonthChange(oos))
                .monthly(new MonthlySeries(labels, oos, all))
                .states(topRegions(tables.regions()))
                .stateMonthly(regionMonthly(tables))
                .biggestMovers(biggestMovers(tables, months))
                .stateCount((int) tables.regions().values().stream().filter(c -> c.oos() > 0).count())
                .dataSource(AggregateSnapshot.SOURCE_REAL)
                .build();
    }

    // ── Individual figures ───────────────────────────────────────────────────

    static double oosRate(int totalOos, int totalAll) {
        if (totalAll <= 0) return 0;
        return round1((double) totalOos / totalAll * 100);
    }

    static long averagePerMonth(int totalOos, int monthCount) {
        if (monthCount <= 0) return 0;
        return new BigDecimal((double) totalOos / monthCount).setScale(0, RoundingMode.HALF_EVEN).longValue();
    }

    /** First month holding the highest OOS count, scanning oldest to newest; null with no months. */
    static Map.Entry<YearMonth, BucketCount> peakMonth(SortedMap<YearMonth, BucketCount> monthly) {
        Map.Entry<YearMonth, BucketCount> peak = null;
        for (Map.Entry<YearMonth, BucketCount> e : monthly.entrySet()) {
            if (peak == null || e.getValue().oos() > peak.getValue().oos()) {
                peak = e;
            }
        }
        return peak;
    }

    /**
     * Percentage change of the last complete month against the one before.
     * With three or more months the newest is skipped as incomplete; with two
     * both are used; otherwise 0.
     */
    static double monthOverMonthChange(List<Integer> oosSeries) {
        int n = oosSeries.size();
        if (n >= 3) return percentChange(oosSeries.get(n - 2), oosSeries.get(n - 3));
        if (n == 2) return percentChange(oosSeries.get(1), oosSeries.get(0));
        return 0;
    }

    List<RegionCount> topRegions(SortedMap<String, BucketCount> regions) {
        return regions.entrySet().stream()
                .sorted(Comparator.<Map.Entry<String, BucketCount>>comparingInt(e -> e.getValue().oos())
                        .reversed()
                        .thenComparing(e -> e.getKey()))
                .limit(properties.getStatistics().getTopRegions())
                .map(e -> new RegionCount(e.getKey(), e.getValue().oos(), e.getValue().all()))
                .toList();
    }

    /**
     * Regions whose OOS count moved most between the two reference months.
     * Regions below the minimum previous-month volume are left out, since a
     * move from 1 to 0 reads as -100%.
     *
     * Increases and decreases are ranked separately by sign rather than as the
     * top and bottom of one ranked list: a region that grew never appears
     * under decreases, an unchanged region appears in neither, and either side
     * may hold fewer entries than the limit.
     */
    BiggestMovers biggestMovers(CountTables tables, List<YearMonth> months) {
        if (months.size() < 3) return BiggestMovers.NONE;

        YearMonth current = months.get(months.size() - 2);
        YearMonth previous = months.get(months.size() - 3);
        int minPrevious = properties.getStatistics().getMoverMinPrevious();

        List<RegionMove> moves = new ArrayList<>();
        for (String region : tables.regionMonthly().keySet()) {
            int cur = tables.cell(region, current).oos();
            int prev = tables.cell(region, previous).oos();
            if (prev >= minPrevious && prev > 0) {
                moves.add(new RegionMove(region, cur, prev, percentChange(cur, prev)));
            }
        }

        int limit = properties.getStatistics().getMoverLimit();
        List<RegionMove> increases = moves.stream()
                .filter(m -> m.current() > m.previous())
                .sorted(BY_CHANGE_DESC)
                .limit(limit)
                .toList();
        List<RegionMove> decreases = moves.stream()
                .filter(m -> m.current() < m.previous())
                .sorted(BY_CHANGE_ASC)
                .limit(limit)
                .toList();

        return new BiggestMovers(increases, decreases);
    }

    private static Map<String, Map<String, BucketCount>> regionMonthly(CountTables tables) {
        Map<String, Map<String, BucketCount>> out = new LinkedHashMap<>();
        tables.regionMonthly().forEach((region, cells) -> {
            Map<String, BucketCount> byLabel = new LinkedHashMap<>();
            cells.forEach((month, count) -> byLabel.put(monthLabel(month), count));
            out.put(region, byLabel);
        });
        return out;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    static String monthLabel(YearMonth month) {
        return month.format(MONTH_LABEL);
    }

    static double percentChange(int current, int previous) {
        if (previous <= 0) return 0;
        return round1((double) (current - previous) / previous * 100);
    }

    /** Unrounded change, so ties in the rounded figure still order by size. */
    private static double rawChange(RegionMove m) {
        return (double) (m.current() - m.previous()) / m.previous();
    }

    static double round1(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return 0;
        return new BigDecimal(value).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
    }
}
