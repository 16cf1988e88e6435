package ai.fingerprint.sketch;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Histogram counting occurrences of each distinct category.
 */
public class CategoricalHistogram implements HistogramSketch<Object> {

    private final Map<Object, Long> counts = new HashMap<>();
    private long total;
    private long nilCount;

    @Override
    public CategoricalHistogram insert(Object value) {
        total++;
        if (value == null) {
            nilCount++;
        } else {
            counts.merge(value, 1L, Long::sum);
        }
        return this;
    }

    @Override
    public long totalCount() {
        return total;
    }

    @Override
    public long nilCount() {
        return nilCount;
    }

    @Override
    public boolean isCategorical() {
        return true;
    }

    @Override
    public Double minimum() {
        return null;
    }

    @Override
    public Double maximum() {
        return null;
    }

    @Override
    public Double mean() {
        return null;
    }

    @Override
    public Double median() {
        return null;
    }

    @Override
    public Double variance() {
        return null;
    }

    @Override
    public Map<Double, Double> percentiles(List<Double> ranks) {
        return Collections.emptyMap();
    }

    @Override
    public Double cdf(double x) {
        return null;
    }

    @Override
    public double cumulativeSum(double x) {
        return 0;
    }

    /**
     * Categories ordered naturally when they are mutually comparable, by descending count otherwise.
     */
    @Override
    public Map<Object, Long> categoryCounts() {
        Map<Object, Long> ordered = new LinkedHashMap<>(counts.size());
        counts.entrySet()
            .stream()
            .sorted(Categories.orderFor(counts.keySet()))
            .forEach(e -> ordered.put(e.getKey(), e.getValue()));
        return Collections.unmodifiableMap(ordered);
    }

    public int distinctCategories() {
        return counts.size();
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>(3);
        result.put("count", total);
        result.put("nil-count", nilCount);
        result.put("categories", categoryCounts());
        return result;
    }

    @Override
    public String toString() {
        return "CategoricalHistogram" + toMap();
    }
}
