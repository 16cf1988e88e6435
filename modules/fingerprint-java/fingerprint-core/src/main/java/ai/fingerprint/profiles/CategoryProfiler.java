package ai.fingerprint.profiles;

import ai.fingerprint.aggregate.Aggregator;
import ai.fingerprint.aggregate.Aggregators;
import ai.fingerprint.aggregate.FusedResult;
import ai.fingerprint.sketch.CategoricalHistogram;
import ai.fingerprint.sketch.SketchAggregators;
import ai.fingerprint.types.Field;

import java.util.LinkedHashMap;
import java.util.Map;

import static ai.fingerprint.profiles.FingerprintKeys.CARDINALITY;
import static ai.fingerprint.profiles.FingerprintKeys.HISTOGRAM;

public class CategoryProfiler implements ProfilerStrategy {

    @Override
    public String name() {
        return "category";
    }

    @Override
    public Aggregator<?, Object, Fingerprint> aggregator(ProfilingOptions options, Field... fields) {
        Values.requireArity(name(), 1, fields);
        Field field = fields[0];

        Map<String, Aggregator<?, Object, ?>> parts = new LinkedHashMap<>();
        parts.put(HISTOGRAM, SketchAggregators.categoricalHistogram());
        parts.put(CARDINALITY, SketchAggregators.cardinality());

        Aggregator<Map<String, Object>, Object, FusedResult> fused = Aggregators.fuse(parts);
        return Aggregators.postComplete(fused, result -> {
            CategoricalHistogram histogram = result.get(HISTOGRAM);
            Long cardinality = result.get(CARDINALITY);
            return new CategoryFingerprint(field, histogram, cardinality);
        });
    }
}
