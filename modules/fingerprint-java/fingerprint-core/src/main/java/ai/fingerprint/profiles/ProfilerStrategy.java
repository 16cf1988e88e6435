package ai.fingerprint.profiles;

import ai.fingerprint.aggregate.Aggregator;
import ai.fingerprint.types.Field;

/**
 * Builds the one-pass aggregator producing a fingerprint variant.
 */
public interface ProfilerStrategy {

    String name();

    /**
     * @param fields the profiled field, or the two fields of a bivariate variant. Items of bivariate
     *               aggregators are pairs of values.
     */
    Aggregator<?, Object, Fingerprint> aggregator(ProfilingOptions options, Field... fields);

}
