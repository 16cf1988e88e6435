package ai.fingerprint.profiles;

import ai.fingerprint.aggregate.Aggregator;
import ai.fingerprint.aggregate.Aggregators;
import ai.fingerprint.aggregate.FusedResult;
import ai.fingerprint.stats.LinearRegression;
import ai.fingerprint.stats.StatAggregators;
import ai.fingerprint.types.Field;
import ai.fingerprint.util.Pair;

import java.util.LinkedHashMap;
import java.util.Map;

import static ai.fingerprint.profiles.FingerprintKeys.*;

/**
 * Two numeric columns: regression of the second on the first, correlation and covariance.
 */
public class NumberPairProfiler implements ProfilerStrategy {

    @Override
    public String name() {
        return "number-pair";
    }

    @Override
    public Aggregator<?, Object, Fingerprint> aggregator(ProfilingOptions options, Field... fields) {
        Values.requireArity(name(), 2, fields);
        Field x = fields[0];
        Field y = fields[1];

        Map<String, Aggregator<?, ? super Pair<Double, Double>, ?>> parts = new LinkedHashMap<>();
        parts.put(LINEAR_REGRESSION, StatAggregators.simpleLinearRegression());
        parts.put(CORRELATION, StatAggregators.correlation());
        parts.put(COVARIANCE, StatAggregators.covariance());
        parts.put(COUNT, Aggregators.count());

        Aggregator<Map<String, Object>, Pair<Double, Double>, FusedResult> fused = Aggregators.fuse(parts);
        Aggregator<Map<String, Object>, Object, FusedResult> coerced = Aggregators.preStep(item -> {
            Pair<Object, Object> pair = Values.pair(item);
            return Pair.of(Values.finiteNumber(x, pair.left()), Values.finiteNumber(y, pair.right()));
        }, fused);
        return Aggregators.postComplete(coerced, result -> {
            Long count = result.get(COUNT);
            LinearRegression regression = result.get(LINEAR_REGRESSION);
            Double correlation = result.get(CORRELATION);
            Double covariance = result.get(COVARIANCE);
            return new NumberPairFingerprint(x, y, count, regression, correlation, covariance);
        });
    }
}
