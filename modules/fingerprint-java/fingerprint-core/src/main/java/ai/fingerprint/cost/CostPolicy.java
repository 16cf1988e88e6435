package ai.fingerprint.cost;

/**
 * Decides which expensive statistics a budget allows.
 */
public interface CostPolicy {

    /**
     * Statistics like sum and sum of squares are only meaningful over the whole table.
     */
    boolean allowsFullScan(MaxCost maxCost);

    /**
     * Algorithms superlinear in the number of values, e.g. seasonal decomposition.
     */
    boolean allowsUnboundedComputation(MaxCost maxCost);

}
