package ai.fingerprint.temporal;

import ai.fingerprint.util.Pair;

import java.time.Period;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Operations over (epoch millis, value) series.
 */
public final class TimeSeries {

    private TimeSeries() {
    }

    /**
     * Builds a contiguous series with one point per {@code step} from the first to the last point
     * of the chronologically sorted {@code series}. Periods missing from the input are filled with 0.
     */
    public static List<Pair<Double, Double>> fill(Period step, List<Pair<Double, Double>> series) {
        if (series.isEmpty()) {
            return Collections.emptyList();
        }
        if (step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("Period step should be positive, got " + step);
        }
        Map<Double, Double> index = new HashMap<>(series.size());
        for (Pair<Double, Double> point : series) {
            index.put(point.left(), point.right());
        }
        double last = series.get(series.size() - 1).left();
        ZonedDateTime first = Timestamps.fromEpochMillis(series.get(0).left());

        List<Pair<Double, Double>> filled = new ArrayList<>(series.size());
        for (int i = 0; ; i++) {
            double t = first.plus(step.multipliedBy(i)).toInstant().toEpochMilli();
            if (t > last) {
                break;
            }
            filled.add(Pair.of(t, index.containsKey(t) ? index.get(t) : Double.valueOf(0)));
        }
        return filled;
    }
}
