package ai.fingerprint.bins;

import java.util.Objects;

/**
 * Bounds, width and count of equidistant bins.
 */
public class BinnedRange {

    private final double minValue;
    private final double maxValue;
    private final double binWidth;
    private final long numBins;
    private final BinStrategy strategy;

    public BinnedRange(double minValue, double maxValue, double binWidth, long numBins, BinStrategy strategy) {
        if (numBins < 1) {
            throw new IllegalArgumentException("Number of bins should be positive, got " + numBins);
        }
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.binWidth = binWidth;
        this.numBins = numBins;
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    public static BinnedRange byCount(double minValue, double maxValue, long numBins) {
        return new BinnedRange(minValue, maxValue, BinNiceifier.binWidth(minValue, maxValue, numBins), numBins, BinStrategy.BY_COUNT);
    }

    public static BinnedRange byWidth(double minValue, double maxValue, double binWidth) {
        return new BinnedRange(minValue, maxValue, binWidth, BinNiceifier.numBins(minValue, maxValue, binWidth), BinStrategy.BY_WIDTH);
    }

    public double getMinValue() {
        return minValue;
    }

    public double getMaxValue() {
        return maxValue;
    }

    public double getBinWidth() {
        return binWidth;
    }

    public long getNumBins() {
        return numBins;
    }

    public BinStrategy getStrategy() {
        return strategy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BinnedRange that = (BinnedRange) o;
        return Double.compare(that.minValue, minValue) == 0
            && Double.compare(that.maxValue, maxValue) == 0
            && Double.compare(that.binWidth, binWidth) == 0
            && numBins == that.numBins
            && strategy == that.strategy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minValue, maxValue, binWidth, numBins, strategy);
    }

    @Override
    public String toString() {
        return String.format("BinnedRange{[%s, %s], width=%s, bins=%d, %s}", minValue, maxValue, binWidth, numBins, strategy);
    }
}
