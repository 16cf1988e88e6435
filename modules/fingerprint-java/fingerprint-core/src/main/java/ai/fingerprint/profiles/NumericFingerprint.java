package ai.fingerprint.profiles;

import ai.fingerprint.bins.Histograms;
import ai.fingerprint.sketch.CardinalitySketch;
import ai.fingerprint.sketch.NumericHistogram;
import ai.fingerprint.types.Field;
import ai.fingerprint.types.TypeSignature;

import java.util.Map;

import static ai.fingerprint.profiles.FingerprintKeys.*;
import static ai.fingerprint.util.Numbers.safeDivide;

/**
 * Fingerprint of a numeric column. A column without values only carries its count.
 */
public class NumericFingerprint extends AbstractFingerprint {

    private final long count;
    private final NumericHistogram histogram;
    private final Map<Double, Double> percentiles;
    private final Long cardinality;
    private final Double uniqueness;
    private final Double nilPercent;
    private final Boolean hasNils;
    private final Double min;
    private final Double max;
    private final Double mean;
    private final Double median;
    private final Double var;
    private final Double sd;
    private final Double range;
    private final Double kurtosis;
    private final Double skewness;
    private final Double entropy;
    private final Double sum;
    private final Double sumOfSquares;

    /**
     * @param sum          null when the budget does not allow full scans
     * @param sumOfSquares null when the budget does not allow full scans
     */
    public NumericFingerprint(Field field,
                              NumericHistogram histogram,
                              long cardinality,
                              Double kurtosis,
                              Double skewness,
                              Double sum,
                              Double sumOfSquares) {
        super(TypeSignature.NUMBER, field);
        this.count = histogram.totalCount();
        if (count == 0) {
            this.histogram = null;
            this.percentiles = null;
            this.cardinality = null;
            this.uniqueness = null;
            this.nilPercent = null;
            this.hasNils = null;
            this.min = null;
            this.max = null;
            this.mean = null;
            this.median = null;
            this.var = null;
            this.sd = null;
            this.range = null;
            this.kurtosis = null;
            this.skewness = null;
            this.entropy = null;
            this.sum = null;
            this.sumOfSquares = null;
            return;
        }
        this.histogram = histogram;
        this.percentiles = histogram.percentiles(NumericProfiler.PERCENTILES);
        this.cardinality = cardinality;
        this.uniqueness = Math.min(1.0, share(cardinality, count));
        this.nilPercent = share(histogram.nilCount(), count);
        this.hasNils = histogram.nilCount() > 0;
        this.min = histogram.minimum();
        this.max = histogram.maximum();
        this.mean = histogram.mean();
        this.median = histogram.median();
        this.var = histogram.variance() == null ? 0.0 : histogram.variance();
        this.sd = Math.sqrt(var);
        this.range = min == null ? null : max - min;
        this.kurtosis = kurtosis;
        this.skewness = skewness;
        this.entropy = Histograms.entropy(histogram);
        this.sum = sum;
        this.sumOfSquares = sumOfSquares;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    @Override
    public long getCount() {
        return count;
    }

    public NumericHistogram getHistogram() {
        return histogram;
    }

    public Map<Double, Double> getPercentiles() {
        return percentiles;
    }

    public Long getCardinality() {
        return cardinality;
    }

    public Double getUniqueness() {
        return uniqueness;
    }

    public Double getNilPercent() {
        return nilPercent;
    }

    public Boolean getHasNils() {
        return hasNils;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    public Double getMean() {
        return mean;
    }

    public Double getMedian() {
        return median;
    }

    public Double getVar() {
        return var;
    }

    public Double getSd() {
        return sd;
    }

    public Double getRange() {
        return range;
    }

    public Double getKurtosis() {
        return kurtosis;
    }

    public Double getSkewness() {
        return skewness;
    }

    public Double getEntropy() {
        return entropy;
    }

    public Double getSum() {
        return sum;
    }

    public Double getSumOfSquares() {
        return sumOfSquares;
    }

    public Double getShareAboveMean() {
        if (mean == null) {
            return null;
        }
        return 1 - histogram.cdf(mean);
    }

    public Boolean isPositiveDefinite() {
        return min == null ? null : min >= 0;
    }

    public Boolean isAllDistinct() {
        return uniqueness == null ? null : uniqueness >= 1 - CardinalitySketch.DEFAULT_ERROR;
    }

    public Double getCv() {
        return safeDivide(sd, mean);
    }

    @Override
    protected void putStatistics(Map<String, Object> result) {
        if (isEmpty()) {
            result.put(COUNT, count);
            return;
        }
        result.put(HISTOGRAM, histogram);
        result.put(PERCENTILES, percentiles);
        result.put(POSITIVE_DEFINITE, isPositiveDefinite());
        result.put(SHARE_ABOVE_MEAN, getShareAboveMean());
        result.put(UNIQUENESS, uniqueness);
        result.put(VAR_ABOVE_SD, var > sd);
        result.put(NIL_PERCENT, nilPercent);
        result.put(HAS_NILS, hasNils);
        result.put(UNIT_INTERVAL, min != null && 0 <= min && max <= 1);
        result.put(SYMMETRIC_UNIT_INTERVAL, min != null && -1 <= min && max <= 1);
        result.put(CV, getCv());
        result.put(RANGE_VS_SD, safeDivide(sd, range));
        result.put(MEAN_MEDIAN_SPREAD, mean == null ? null : safeDivide(mean - median, range));
        result.put(MIN_VS_MAX, safeDivide(min, max));
        result.put(RANGE, range);
        result.put(CARDINALITY, cardinality);
        result.put(MIN, min);
        result.put(MAX, max);
        result.put(MEAN, mean);
        result.put(MEDIAN, median);
        result.put(VAR, var);
        result.put(SD, sd);
        result.put(COUNT, count);
        result.put(KURTOSIS, kurtosis);
        result.put(SKEWNESS, skewness);
        result.put(ALL_DISTINCT, isAllDistinct());
        result.put(ENTROPY, entropy);
        if (sum != null) {
            result.put(SUM, sum);
            result.put(SUM_OF_SQUARES, sumOfSquares);
        }
    }

    @Override
    public Map<String, Object> toDisplay() {
        Map<String, Object> display = without(
            toMap(),
            HAS_NILS, VAR_ABOVE_SD, UNIT_INTERVAL, SYMMETRIC_UNIT_INTERVAL, ALL_DISTINCT,
            POSITIVE_DEFINITE, UNIQUENESS, MIN_VS_MAX
        );
        if (!isEmpty()) {
            display.put(HISTOGRAM, HistogramDataset.of(getField(), histogram).toMap());
        }
        return display;
    }

    @Override
    public Map<String, Object> toComparisonVector() {
        return only(
            toMap(),
            HISTOGRAM, MEAN, MEDIAN, MIN, MAX, SD, COUNT, KURTOSIS, SKEWNESS, ENTROPY,
            NIL_PERCENT, UNIQUENESS, RANGE, MIN_VS_MAX
        );
    }
}
