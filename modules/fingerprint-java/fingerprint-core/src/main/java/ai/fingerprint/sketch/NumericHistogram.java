package ai.fingerprint.sketch;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.datasketches.kll.KllDoublesSketch;
import org.apache.datasketches.quantilescommon.QuantileSearchCriteria;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Histogram of numbers. Quantile queries are approximate (KLL sketch), count, extremes, mean and
 * variance are exact.
 */
public class NumericHistogram implements HistogramSketch<Double> {

    private final KllDoublesSketch quantiles;
    private final SummaryStatistics moments;
    private long nilCount;

    public NumericHistogram(int k) {
        this.quantiles = KllDoublesSketch.newHeapInstance(k);
        this.moments = new SummaryStatistics();
    }

    @Override
    public NumericHistogram insert(Double value) {
        if (value == null || value.isNaN()) {
            nilCount++;
        } else {
            quantiles.update(value);
            moments.addValue(value);
        }
        return this;
    }

    public long nonNilCount() {
        return moments.getN();
    }

    @Override
    public long totalCount() {
        return moments.getN() + nilCount;
    }

    @Override
    public long nilCount() {
        return nilCount;
    }

    @Override
    public boolean isCategorical() {
        return false;
    }

    public boolean isEmpty() {
        return quantiles.isEmpty();
    }

    @Override
    public Double minimum() {
        return isEmpty() ? null : moments.getMin();
    }

    @Override
    public Double maximum() {
        return isEmpty() ? null : moments.getMax();
    }

    @Override
    public Double mean() {
        return isEmpty() ? null : moments.getMean();
    }

    @Override
    public Double median() {
        return isEmpty() ? null : quantiles.getQuantile(0.5);
    }

    @Override
    public Double variance() {
        return isEmpty() ? null : moments.getPopulationVariance();
    }

    @Override
    public Map<Double, Double> percentiles(List<Double> ranks) {
        if (isEmpty()) {
            return Collections.emptyMap();
        }
        Map<Double, Double> result = new LinkedHashMap<>(ranks.size());
        for (Double rank : ranks) {
            result.put(rank, quantiles.getQuantile(rank));
        }
        return result;
    }

    @Override
    public Double cdf(double x) {
        return isEmpty() ? null : quantiles.getRank(x, QuantileSearchCriteria.INCLUSIVE);
    }

    @Override
    public double cumulativeSum(double x) {
        if (isEmpty()) {
            return 0;
        }
        // ranks are item weights over n, so the product is a whole number up to rounding
        return Math.rint(quantiles.getRank(x, QuantileSearchCriteria.EXCLUSIVE) * moments.getN());
    }

    @Override
    public Map<Object, Long> categoryCounts() {
        return Collections.emptyMap();
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>(4);
        result.put("count", totalCount());
        result.put("nil-count", nilCount);
        result.put("min", minimum());
        result.put("max", maximum());
        return result;
    }

    @Override
    public String toString() {
        return "NumericHistogram" + toMap();
    }
}
