package ai.fingerprint.profiles;

import ai.fingerprint.aggregate.Aggregator;
import ai.fingerprint.aggregate.Aggregators;
import ai.fingerprint.aggregate.FusedResult;
import ai.fingerprint.sketch.CategoricalHistogram;
import ai.fingerprint.sketch.NumericHistogram;
import ai.fingerprint.sketch.SketchAggregators;
import ai.fingerprint.temporal.Periodicity;
import ai.fingerprint.temporal.Timestamps;
import ai.fingerprint.types.Field;

import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import static ai.fingerprint.profiles.FingerprintKeys.*;

/**
 * Date-times: distribution of instants plus hour of day, day of week, month and quarter of year
 * frequencies, all in UTC.
 */
public class DateTimeProfiler implements ProfilerStrategy {

    @Override
    public String name() {
        return "date-time";
    }

    @Override
    public Aggregator<?, Object, Fingerprint> aggregator(ProfilingOptions options, Field... fields) {
        Values.requireArity(name(), 1, fields);
        Field field = fields[0];

        Map<String, Aggregator<?, ? super Double, ?>> parts = new LinkedHashMap<>();
        parts.put(HISTOGRAM, SketchAggregators.numericHistogram(options.getHistogramK()));
        parts.put(HISTOGRAM_HOUR, cyclical(ZonedDateTime::getHour));
        parts.put(HISTOGRAM_DAY, cyclical(dt -> dt.getDayOfWeek().getValue()));
        parts.put(HISTOGRAM_MONTH, cyclical(ZonedDateTime::getMonthValue));
        parts.put(HISTOGRAM_QUARTER, cyclical(Periodicity::quarter));

        Aggregator<Map<String, Object>, Double, FusedResult> fused = Aggregators.fuse(parts);
        Aggregator<Map<String, Object>, Object, FusedResult> parsed =
            Aggregators.preStep(value -> Values.epochMillis(field, value), fused);
        return Aggregators.postComplete(parsed, result -> {
            NumericHistogram histogram = result.get(HISTOGRAM);
            CategoricalHistogram hours = result.get(HISTOGRAM_HOUR);
            CategoricalHistogram days = result.get(HISTOGRAM_DAY);
            CategoricalHistogram months = result.get(HISTOGRAM_MONTH);
            CategoricalHistogram quarters = result.get(HISTOGRAM_QUARTER);
            return new DateTimeFingerprint(field, histogram, hours, days, months, quarters);
        });
    }

    private static Aggregator<CategoricalHistogram, Double, CategoricalHistogram> cyclical(Function<ZonedDateTime, Integer> bucket) {
        return Aggregators.preStep(
            (Double epochMillis) -> epochMillis == null ? null : bucket.apply(Timestamps.fromEpochMillis(epochMillis)),
            SketchAggregators.categoricalHistogram()
        );
    }
}
