package ai.fingerprint.temporal;

import java.util.ArrayList;
import java.util.List;

/**
 * Classical additive decomposition: centred moving average trend, seasonal component from the
 * average detrended value at each position of the season.
 */
public class ClassicalSeasonalDecomposer implements SeasonalDecomposer {

    @Override
    public SeasonalDecomposition decompose(int period, double[] series) {
        if (period < 2) {
            throw new IllegalArgumentException("Period should be at least 2, got " + period);
        }
        if (series.length < 2 * period) {
            throw new IllegalArgumentException(String.format("Need at least %d points for period %d, got %d", 2 * period, period, series.length));
        }
        Double[] trend = movingAverage(period, series);

        double[] seasonSums = new double[period];
        int[] seasonCounts = new int[period];
        for (int i = 0; i < series.length; i++) {
            if (trend[i] != null) {
                seasonSums[i % period] += series[i] - trend[i];
                seasonCounts[i % period]++;
            }
        }
        double[] index = new double[period];
        double indexMean = 0;
        for (int j = 0; j < period; j++) {
            index[j] = seasonCounts[j] == 0 ? 0 : seasonSums[j] / seasonCounts[j];
            indexMean += index[j] / period;
        }

        List<Double> trendList = new ArrayList<>(series.length);
        List<Double> seasonal = new ArrayList<>(series.length);
        List<Double> remainder = new ArrayList<>(series.length);
        for (int i = 0; i < series.length; i++) {
            double s = index[i % period] - indexMean;
            trendList.add(trend[i]);
            seasonal.add(s);
            remainder.add(trend[i] == null ? null : series[i] - trend[i] - s);
        }
        return new SeasonalDecomposition(period, trendList, seasonal, remainder);
    }

    /**
     * Centred moving average over one period, a 2xm average for even periods.
     */
    static Double[] movingAverage(int period, double[] series) {
        Double[] trend = new Double[series.length];
        int half = period / 2;
        boolean even = period % 2 == 0;
        double window = 0;
        // running sum of series[i - half .. i + half]
        for (int k = 0; k <= 2 * half && k < series.length; k++) {
            window += series[k];
        }
        for (int i = half; i + half < series.length; i++) {
            if (i > half) {
                window += series[i + half] - series[i - half - 1];
            }
            trend[i] = even
                ? (window - 0.5 * series[i - half] - 0.5 * series[i + half]) / period
                : window / period;
        }
        return trend;
    }
}
