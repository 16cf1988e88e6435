package ai.fingerprint.temporal;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Corrects cyclical (month of year, quarter of year) histograms for unequal numbers of observed cycles.
 */
public final class Periodicity {

    private Periodicity() {
    }

    public static int quarter(ZonedDateTime dt) {
        return (int) Math.ceil(dt.getMonthValue() / 3.0);
    }

    /**
     * Start of the month for the first half of a month, start of the next month otherwise.
     */
    public static ZonedDateTime roundToMonth(ZonedDateTime dt) {
        ZonedDateTime monthStart = dt.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS);
        return dt.getDayOfMonth() <= 15 ? monthStart : monthStart.plusMonths(1);
    }

    /**
     * How many times each month of year (1-12) occurs in [earliest, latest].
     */
    public static Map<Integer, Long> monthFrequencies(ZonedDateTime earliest, ZonedDateTime latest) {
        ZonedDateTime start = roundToMonth(earliest);
        ZonedDateTime end = roundToMonth(latest);
        int startMonth = start.getMonthValue();
        long duration = Math.max(0, ChronoUnit.MONTHS.between(start, end));
        return cycleFrequencies(startMonth, duration, 12);
    }

    /**
     * How many times each quarter of year (1-4) occurs in [earliest, latest].
     */
    public static Map<Integer, Long> quarterFrequencies(ZonedDateTime earliest, ZonedDateTime latest) {
        ZonedDateTime start = roundToMonth(earliest);
        ZonedDateTime end = roundToMonth(latest);
        int startQuarter = quarter(start);
        long duration = Math.round(Math.max(0, ChronoUnit.MONTHS.between(start, end)) / 3.0);
        return cycleFrequencies(startQuarter, duration, 4);
    }

    private static Map<Integer, Long> cycleFrequencies(int start, long duration, int cycle) {
        Map<Integer, Long> frequencies = new TreeMap<>();
        for (long i = start - 1; i < start + duration; i++) {
            frequencies.merge((int) (i % cycle) + 1, 1L, Long::sum);
        }
        return Collections.unmodifiableMap(frequencies);
    }

    /**
     * Rescales each {@code [bucket, value]} row by {@code min(weights) / weights[bucket]}. Rows of
     * buckets without a weight are kept as they are.
     */
    public static List<List<Object>> weigh(Map<Integer, Long> weights, List<List<Object>> rows) {
        if (weights.isEmpty()) {
            return rows;
        }
        long baseline = Collections.min(weights.values());
        List<List<Object>> weighted = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            Object bucket = row.get(0);
            Long weight = bucket instanceof Number ? weights.get(((Number) bucket).intValue()) : null;
            if (weight == null) {
                weighted.add(row);
            } else {
                double value = ((Number) row.get(1)).doubleValue();
                List<Object> rescaled = new ArrayList<>(row);
                rescaled.set(1, value * baseline / weight);
                weighted.add(Collections.unmodifiableList(rescaled));
            }
        }
        return Collections.unmodifiableList(weighted);
    }
}
