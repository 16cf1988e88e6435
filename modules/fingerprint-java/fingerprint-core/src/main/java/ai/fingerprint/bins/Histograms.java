package ai.fingerprint.bins;

import ai.fingerprint.sketch.HistogramSketch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Derived views of histogram sketches: equidistant bins and entropy.
 */
public final class Histograms {

    static final long MAX_BINS = 1000;

    private Histograms() {
    }

    /**
     * Freedman-Diaconis bin width, falling back to Sturges' rule when the interquartile range is
     * empty and to a unit width when all values are equal. Null when the extent of the values
     * overflows a double.
     */
    public static Double optimalBinWidth(HistogramSketch<?> histogram) {
        Double min = histogram.minimum();
        Double max = histogram.maximum();
        if (histogram.isCategorical() || min == null || max == null) {
            return null;
        }
        double range = max - min;
        if (Double.isInfinite(range)) {
            return null;
        }
        long n = histogram.totalCount() - histogram.nilCount();
        Map<Double, Double> quartiles = histogram.percentiles(Arrays.asList(0.25, 0.75));
        double iqr = quartiles.get(0.75) - quartiles.get(0.25);
        double freedmanDiaconis = 2 * iqr * Math.pow(n, -1.0 / 3);
        if (freedmanDiaconis > 0 && !Double.isInfinite(freedmanDiaconis)) {
            return freedmanDiaconis;
        }
        if (range > 0 && n > 1) {
            return range / (Math.ceil(Math.log(n) / Math.log(2)) + 1);
        }
        return 1.0;
    }

    /**
     * Category counts of a categorical histogram, or the counts of nice equidistant bins covering
     * a numeric one. Numeric bins are keyed by their lower bound.
     */
    public static List<Bin> equidistantBins(HistogramSketch<?> histogram) {
        if (histogram.isCategorical()) {
            List<Bin> bins = new ArrayList<>();
            for (Map.Entry<Object, Long> category : histogram.categoryCounts().entrySet()) {
                bins.add(new Bin(category.getKey(), category.getValue()));
            }
            return bins;
        }
        Double min = histogram.minimum();
        Double max = histogram.maximum();
        if (min == null || max == null) {
            return Collections.emptyList();
        }
        long nonNil = histogram.totalCount() - histogram.nilCount();
        Double binWidth = optimalBinWidth(histogram);
        BinnedRange range = binWidth == null ? null : nicerBreakout(min, max, binWidth);
        if (range == null || !isFinite(range)) {
            // the extent overflows a double, a single bin holds every value
            return Collections.singletonList(new Bin(min, nonNil));
        }

        List<Bin> bins = new ArrayList<>((int) range.getNumBins());
        double lower = range.getMinValue();
        double below = histogram.cumulativeSum(lower);
        for (long i = 1; i <= range.getNumBins(); i++) {
            double upper = range.getMinValue() + i * range.getBinWidth();
            // the last boundary closes the range, values equal to the maximum included
            double belowUpper = i == range.getNumBins() ? nonNil : histogram.cumulativeSum(upper);
            bins.add(new Bin(lower, belowUpper - below));
            lower = upper;
            below = belowUpper;
        }
        return bins;
    }

    private static boolean isFinite(BinnedRange range) {
        return Double.isFinite(range.getMinValue())
            && Double.isFinite(range.getMinValue() + range.getNumBins() * range.getBinWidth());
    }

    static BinnedRange nicerBreakout(double min, double max, double binWidth) {
        long numBins = Math.min(MAX_BINS, BinNiceifier.numBins(min, max, binWidth));
        return BinNiceifier.nicerBreakout(new BinnedRange(min, max, binWidth, numBins, BinStrategy.BY_COUNT));
    }

    /**
     * Shannon entropy (natural logarithm) of the distribution over {@link #equidistantBins}.
     */
    public static double entropy(HistogramSketch<?> histogram) {
        List<Bin> bins = equidistantBins(histogram);
        double total = 0;
        for (Bin bin : bins) {
            total += bin.getCount();
        }
        if (total <= 0) {
            return 0.0;
        }
        double entropy = 0;
        for (Bin bin : bins) {
            if (bin.getCount() > 0) {
                double p = bin.getCount() / total;
                entropy -= p * Math.log(p);
            }
        }
        return entropy;
    }
}
