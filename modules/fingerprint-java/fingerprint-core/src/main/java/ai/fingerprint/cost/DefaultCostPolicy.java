package ai.fingerprint.cost;

public class DefaultCostPolicy implements CostPolicy {

    @Override
    public boolean allowsFullScan(MaxCost maxCost) {
        return maxCost.getQuery() == QueryCost.FULL_SCAN || maxCost.getQuery() == QueryCost.JOINS;
    }

    @Override
    public boolean allowsUnboundedComputation(MaxCost maxCost) {
        return maxCost.getComputation() == ComputationCost.UNBOUNDED || maxCost.getComputation() == ComputationCost.YOLO;
    }
}
