package ai.fingerprint.profiles;

import ai.fingerprint.aggregate.Aggregator;
import ai.fingerprint.aggregate.Aggregators;
import ai.fingerprint.aggregate.FusedResult;
import ai.fingerprint.sketch.NumericHistogram;
import ai.fingerprint.sketch.SketchAggregators;
import ai.fingerprint.stats.StatAggregators;
import ai.fingerprint.types.Field;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static ai.fingerprint.profiles.FingerprintKeys.*;

/**
 * Numbers: distribution, moments and derived ratios. Sums need a budget allowing full scans.
 */
public class NumericProfiler implements ProfilerStrategy {

    /**
     * Ranks of the reported percentiles.
     */
    public static final List<Double> PERCENTILES = Collections.unmodifiableList(
        Arrays.asList(0.0, 0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.9));

    @Override
    public String name() {
        return "numeric";
    }

    @Override
    public Aggregator<?, Object, Fingerprint> aggregator(ProfilingOptions options, Field... fields) {
        Values.requireArity(name(), 1, fields);
        Field field = fields[0];
        boolean includeSums = options.allowsFullScan();

        Map<String, Aggregator<?, ? super Double, ?>> parts = new LinkedHashMap<>();
        parts.put(HISTOGRAM, SketchAggregators.numericHistogram(options.getHistogramK()));
        parts.put(CARDINALITY, SketchAggregators.cardinality());
        parts.put(KURTOSIS, StatAggregators.kurtosis());
        parts.put(SKEWNESS, StatAggregators.skewness());
        parts.put(SUM, Aggregators.sum());
        parts.put(SUM_OF_SQUARES, Aggregators.preStep((Double x) -> x == null ? null : x * x, Aggregators.sum()));

        Aggregator<Map<String, Object>, Double, FusedResult> fused = Aggregators.fuse(parts);
        Aggregator<Map<String, Object>, Object, FusedResult> coerced =
            Aggregators.preStep(value -> Values.finiteNumber(field, value), fused);
        return Aggregators.postComplete(coerced, result -> {
            NumericHistogram histogram = result.get(HISTOGRAM);
            Long cardinality = result.get(CARDINALITY);
            Double kurtosis = result.get(KURTOSIS);
            Double skewness = result.get(SKEWNESS);
            Double sum = result.get(SUM);
            Double sumOfSquares = result.get(SUM_OF_SQUARES);
            return new NumericFingerprint(
                field,
                histogram,
                cardinality,
                kurtosis,
                skewness,
                includeSums ? sum : null,
                includeSums ? sumOfSquares : null
            );
        });
    }
}
