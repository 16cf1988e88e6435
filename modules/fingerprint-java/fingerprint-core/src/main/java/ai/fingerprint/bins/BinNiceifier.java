package ai.fingerprint.bins;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static ai.fingerprint.util.Numbers.ceilTo;
import static ai.fingerprint.util.Numbers.floorTo;
import static ai.fingerprint.util.Numbers.orderOfMagnitude;
import static ai.fingerprint.util.Numbers.roundToDecimals;

/**
 * Rounds bin boundaries and widths to values people like to read.
 */
public final class BinNiceifier {

    private static final Logger LOG = LoggerFactory.getLogger(BinNiceifier.class);

    static final double[] PLEASING_NUMBERS = {1, 1.25, 2, 2.5, 3, 5, 7.5, 10};
    static final int MAX_STEPS = 10;

    private BinNiceifier() {
    }

    static double binWidth(double minValue, double maxValue, long numBins) {
        return roundToDecimals(5, (maxValue - minValue) / numBins);
    }

    static long numBins(double minValue, double maxValue, double binWidth) {
        if (binWidth <= 0) {
            throw new IllegalArgumentException("Bin width should be positive, got " + binWidth);
        }
        return Math.max(1, (long) Math.ceil((maxValue - minValue) / binWidth));
    }

    /**
     * Smallest pleasing multiple of a power of ten not less than the raw bin width.
     */
    static double nicerBinWidth(double minValue, double maxValue, long numBins) {
        double minBinWidth = binWidth(minValue, maxValue, numBins);
        double scale = Math.pow(10, orderOfMagnitude(minBinWidth));
        for (double pleasing : PLEASING_NUMBERS) {
            double candidate = pleasing * scale;
            if (candidate >= minBinWidth) {
                return candidate;
            }
        }
        return 10 * scale;
    }

    static BinnedRange step(BinnedRange range) {
        boolean byCount = range.getStrategy() == BinStrategy.BY_COUNT;
        double binWidth = byCount
            ? nicerBinWidth(range.getMinValue(), range.getMaxValue(), range.getNumBins())
            : range.getBinWidth();
        double minValue = floorTo(binWidth, range.getMinValue());
        double maxValue = ceilTo(binWidth, range.getMaxValue());
        long numBins = byCount ? range.getNumBins() : numBins(minValue, maxValue, binWidth);
        return new BinnedRange(minValue, maxValue, binWidth, numBins, range.getStrategy());
    }

    /**
     * Refines {@code range} until two consecutive refinements agree, at most {@value #MAX_STEPS} times.
     * The last refinement is returned when they never agree.
     */
    public static BinnedRange nicerBreakout(BinnedRange range) {
        BinnedRange current = range;
        for (int i = 0; i < MAX_STEPS; i++) {
            BinnedRange next = step(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        LOG.warn("Bins did not converge after {} steps, using {}", MAX_STEPS, current);
        return current;
    }
}
