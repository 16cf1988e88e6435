package ai.fingerprint.temporal;

/**
 * Seasonal-trend decomposition routine.
 */
public interface SeasonalDecomposer {

    /**
     * @param period number of points in one season
     * @param series evenly spaced values, at least two periods long
     */
    SeasonalDecomposition decompose(int period, double[] series);

}
