package ai.fingerprint.profiles;

import ai.fingerprint.aggregate.Aggregator;
import ai.fingerprint.aggregate.Aggregators;
import ai.fingerprint.aggregate.FusedResult;
import ai.fingerprint.types.Field;
import ai.fingerprint.types.TypeSignature;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static ai.fingerprint.profiles.FingerprintKeys.COUNT;

/**
 * Any signature: counts values and nils.
 */
public class DefaultProfiler implements ProfilerStrategy {

    private static final String NIL_COUNT = "nil-count";

    @Override
    public String name() {
        return "default";
    }

    @Override
    public Aggregator<?, Object, Fingerprint> aggregator(ProfilingOptions options, Field... fields) {
        if (fields == null || fields.length == 0 || fields.length > 2) {
            throw new IllegalArgumentException("Profiling takes one field or a pair of fields, got "
                + (fields == null ? 0 : fields.length));
        }
        TypeSignature type = TypeSignature.of(fields);

        Map<String, Aggregator<?, Object, ?>> parts = new LinkedHashMap<>();
        parts.put(COUNT, Aggregators.count());
        parts.put(NIL_COUNT, Aggregators.withFilter(Objects::isNull, Aggregators.count()));

        Aggregator<Map<String, Object>, Object, FusedResult> fused = Aggregators.fuse(parts);
        return Aggregators.postComplete(fused, result -> {
            Long count = result.get(COUNT);
            Long nilCount = result.get(NIL_COUNT);
            return new DefaultFingerprint(type, count, nilCount, fields);
        });
    }
}
