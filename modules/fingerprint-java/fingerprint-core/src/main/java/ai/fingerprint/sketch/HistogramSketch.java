package ai.fingerprint.sketch;

import java.util.List;
import java.util.Map;

/**
 * Streaming histogram. Numeric histograms answer distribution queries over the non-nil values;
 * categorical histograms count occurrences of each category.
 *
 * @param <T> value type
 */
public interface HistogramSketch<T> {

    /**
     * Adds a value, {@code null} counts as nil.
     *
     * @return this sketch
     */
    HistogramSketch<T> insert(T value);

    /**
     * Number of inserted values, nils included.
     */
    long totalCount();

    long nilCount();

    boolean isCategorical();

    Double minimum();

    Double maximum();

    Double mean();

    Double median();

    Double variance();

    Map<Double, Double> percentiles(List<Double> ranks);

    /**
     * Fraction of the non-nil values less than or equal to {@code x}.
     */
    Double cdf(double x);

    /**
     * Number of non-nil values less than {@code x}.
     */
    double cumulativeSum(double x);

    /**
     * Count per category, empty for numeric histograms.
     */
    Map<Object, Long> categoryCounts();

    /**
     * Summary of the sketch, the way it is serialized.
     */
    Map<String, Object> toMap();
}
