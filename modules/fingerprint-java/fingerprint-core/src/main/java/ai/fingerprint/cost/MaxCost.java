package ai.fingerprint.cost;

import java.util.Objects;

/**
 * Computation budget of a fingerprinting pass.
 */
public class MaxCost {

    public static final MaxCost DEFAULT = new MaxCost(QueryCost.SAMPLE, ComputationCost.LINEAR);

    private final QueryCost query;
    private final ComputationCost computation;

    public MaxCost(QueryCost query, ComputationCost computation) {
        this.query = Objects.requireNonNull(query, "query cost");
        this.computation = Objects.requireNonNull(computation, "computation cost");
    }

    public QueryCost getQuery() {
        return query;
    }

    public ComputationCost getComputation() {
        return computation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MaxCost maxCost = (MaxCost) o;
        return query == maxCost.query && computation == maxCost.computation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, computation);
    }

    @Override
    public String toString() {
        return String.format("{query=%s, computation=%s}", query.propertyValue(), computation.propertyValue());
    }
}
