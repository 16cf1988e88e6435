package ai.fingerprint.profiles;

import ai.fingerprint.stats.LinearRegression;
import ai.fingerprint.temporal.Scale;
import ai.fingerprint.temporal.SeasonalDecomposition;
import ai.fingerprint.temporal.Timestamps;
import ai.fingerprint.types.Field;
import ai.fingerprint.types.TypeSignature;
import ai.fingerprint.util.Pair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static ai.fingerprint.profiles.FingerprintKeys.*;

/**
 * Numeric measure over time. Series points are {@code (epoch millis, value)} pairs, one per period
 * unless the scale is raw.
 */
public class TimeSeriesFingerprint extends AbstractFingerprint {

    private final long count;
    private final Scale scale;
    private final List<Pair<Double, Double>> series;
    private final LinearRegression linearRegression;
    private final SeasonalDecomposition seasonalDecomposition;
    private final Map<String, Double> growth;

    /**
     * @param seasonalDecomposition null when it was not computed
     * @param growth                growth metrics of {@code scale}, keyed by metric name
     */
    public TimeSeriesFingerprint(Field time, Field measure,
                                 long count,
                                 Scale scale,
                                 List<Pair<Double, Double>> series,
                                 LinearRegression linearRegression,
                                 SeasonalDecomposition seasonalDecomposition,
                                 Map<String, Double> growth) {
        super(TypeSignature.DATE_TIME_NUMBER, time, measure);
        this.count = count;
        this.scale = scale;
        this.series = Collections.unmodifiableList(new ArrayList<>(series));
        this.linearRegression = linearRegression;
        this.seasonalDecomposition = seasonalDecomposition;
        this.growth = Collections.unmodifiableMap(new LinkedHashMap<>(growth));
    }

    @Override
    public long getCount() {
        return count;
    }

    public Scale getScale() {
        return scale;
    }

    public List<Pair<Double, Double>> getSeries() {
        return series;
    }

    public LinearRegression getLinearRegression() {
        return linearRegression;
    }

    public SeasonalDecomposition getSeasonalDecomposition() {
        return seasonalDecomposition;
    }

    public Map<String, Double> getGrowth() {
        return growth;
    }

    @Override
    protected void putStatistics(Map<String, Object> result) {
        result.put(SCALE, scale);
        result.put(SERIES, series);
        result.put(LINEAR_REGRESSION, linearRegression);
        if (seasonalDecomposition != null) {
            result.put(SEASONAL_DECOMPOSITION, seasonalDecomposition);
        }
        result.putAll(growth);
        result.put(COUNT, count);
    }

    @Override
    public Map<String, Object> toDisplay() {
        List<List<Object>> points = new ArrayList<>(series.size());
        for (Pair<Double, Double> point : series) {
            points.add(Arrays.asList(Timestamps.fromEpochMillis(point.left()), point.right()));
        }
        Map<String, Object> display = toMap();
        display.put(SERIES, points);
        return display;
    }

    @Override
    public Map<String, Object> toComparisonVector() {
        return without(toMap(), TYPE, SCALE, FIELD);
    }
}
