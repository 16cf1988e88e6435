package ai.fingerprint.profiles;

import ai.fingerprint.FingerprintAppLog;
import ai.fingerprint.aggregate.Aggregator;
import ai.fingerprint.aggregate.Aggregators;
import ai.fingerprint.aggregate.FusedResult;
import ai.fingerprint.stats.LinearRegression;
import ai.fingerprint.stats.StatAggregators;
import ai.fingerprint.temporal.ClassicalSeasonalDecomposer;
import ai.fingerprint.temporal.GrowthMetrics;
import ai.fingerprint.temporal.Scale;
import ai.fingerprint.temporal.SeasonalDecomposer;
import ai.fingerprint.temporal.SeasonalDecomposition;
import ai.fingerprint.temporal.TimeSeries;
import ai.fingerprint.types.Field;
import ai.fingerprint.util.Pair;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import static ai.fingerprint.profiles.FingerprintKeys.COUNT;
import static ai.fingerprint.profiles.FingerprintKeys.SERIES;

/**
 * Numeric measure over time. Unless the scale is raw, the series is reduced to one point per
 * timestamp, sorted and filled to one point per period before anything is derived from it.
 */
public class TimeSeriesProfiler implements ProfilerStrategy {

    private static final FingerprintAppLog LOG = new FingerprintAppLog(LoggerFactory.getLogger(TimeSeriesProfiler.class));

    private final SeasonalDecomposer decomposer;

    public TimeSeriesProfiler(SeasonalDecomposer decomposer) {
        this.decomposer = Objects.requireNonNull(decomposer, "decomposer");
    }

    public TimeSeriesProfiler() {
        this(new ClassicalSeasonalDecomposer());
    }

    @Override
    public String name() {
        return "time-series";
    }

    @Override
    public Aggregator<?, Object, Fingerprint> aggregator(ProfilingOptions options, Field... fields) {
        Values.requireArity(name(), 2, fields);
        Field time = fields[0];
        Field measure = fields[1];
        Scale scale = options.getScale();
        FingerprintAppLog log = LOG.withVerbose(options.isVerbose());

        Map<String, Aggregator<?, ? super Pair<Double, Double>, ?>> parts = new LinkedHashMap<>();
        parts.put(COUNT, Aggregators.count());
        parts.put(SERIES, Aggregators.withFilter(point -> point.left() != null, Aggregators.<Pair<Double, Double>>collect()));

        Aggregator<Map<String, Object>, Pair<Double, Double>, FusedResult> fused = Aggregators.fuse(parts);
        Aggregator<Map<String, Object>, Object, FusedResult> coerced = Aggregators.preStep(item -> {
            Pair<Object, Object> pair = Values.pair(item);
            return Pair.of(Values.epochMillis(time, pair.left()), Values.number(measure, pair.right()));
        }, fused);
        return Aggregators.postComplete(coerced, result -> {
            Long count = result.get(COUNT);
            List<Pair<Double, Double>> collected = result.get(SERIES);
            List<Pair<Double, Double>> series = scale.isRaw() ? collected : TimeSeries.fill(scale.step(), reduce(collected));

            LinearRegression regression = StatAggregators.simpleLinearRegression().reduce(series);
            List<Double> values = new ArrayList<>(series.size());
            for (Pair<Double, Double> point : series) {
                values.add(point.right());
            }
            SeasonalDecomposition decomposition = decompose(options, scale, values, log);
            return new TimeSeriesFingerprint(
                time, measure, count, scale, series, regression, decomposition, GrowthMetrics.forScale(scale, values));
        });
    }

    /**
     * One point per timestamp, the last one seen wins, in chronological order.
     */
    private static List<Pair<Double, Double>> reduce(List<Pair<Double, Double>> points) {
        Map<Double, Double> byTime = new TreeMap<>();
        for (Pair<Double, Double> point : points) {
            byTime.put(point.left(), point.right());
        }
        List<Pair<Double, Double>> reduced = new ArrayList<>(byTime.size());
        byTime.forEach((t, v) -> reduced.add(Pair.of(t, v)));
        return reduced;
    }

    private SeasonalDecomposition decompose(ProfilingOptions options, Scale scale, List<Double> values, FingerprintAppLog log) {
        if (scale.isRaw()) {
            return null;
        }
        if (!options.allowsUnboundedComputation()) {
            log.verbose("Seasonal decomposition skipped, max cost {} does not allow unbounded computation", options.getMaxCost());
            return null;
        }
        int period = scale.seasonalPeriod();
        if (values.size() < 2 * period) {
            log.verbose("Seasonal decomposition skipped, {} points are less than two {} periods", values.size(), period);
            return null;
        }
        double[] series = new double[values.size()];
        for (int i = 0; i < series.length; i++) {
            Double value = values.get(i);
            if (value == null) {
                log.verbose("Seasonal decomposition skipped, series has missing values");
                return null;
            }
            series[i] = value;
        }
        return decomposer.decompose(period, series);
    }
}
