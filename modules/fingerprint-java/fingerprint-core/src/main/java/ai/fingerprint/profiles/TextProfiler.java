package ai.fingerprint.profiles;

import ai.fingerprint.aggregate.Aggregator;
import ai.fingerprint.aggregate.Aggregators;
import ai.fingerprint.sketch.NumericHistogram;
import ai.fingerprint.sketch.SketchAggregators;
import ai.fingerprint.types.Field;

/**
 * Text: distribution of value lengths.
 */
public class TextProfiler implements ProfilerStrategy {

    @Override
    public String name() {
        return "text";
    }

    @Override
    public Aggregator<?, Object, Fingerprint> aggregator(ProfilingOptions options, Field... fields) {
        Values.requireArity(name(), 1, fields);
        Field field = fields[0];

        Aggregator<NumericHistogram, Object, NumericHistogram> lengths = Aggregators.preStep(
            value -> Values.length(field, value),
            SketchAggregators.numericHistogram(options.getHistogramK())
        );
        return Aggregators.postComplete(lengths, histogram -> new TextFingerprint(field, histogram));
    }
}
