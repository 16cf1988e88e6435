package ai.fingerprint.temporal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static ai.fingerprint.util.Numbers.growth;

/**
 * Period over period growth of the most recent values of a series.
 */
public final class GrowthMetrics {

    private GrowthMetrics() {
    }

    /**
     * @param values series values in chronological order
     * @return growth metrics for {@code scale}, a metric is null when the series is too short
     */
    public static Map<String, Double> forScale(Scale scale, List<Double> values) {
        List<Double> latestFirst = new ArrayList<>(values);
        Collections.reverse(latestFirst);

        Map<String, Double> metrics = new LinkedHashMap<>(4);
        switch (scale) {
            case MONTH:
                metrics.put("YoY", growth(nth(latestFirst, 0), nth(latestFirst, 12)));
                metrics.put("YoY-previous", growth(nth(latestFirst, 1), nth(latestFirst, 13)));
                metrics.put("MoM", growth(nth(latestFirst, 0), nth(latestFirst, 1)));
                metrics.put("MoM-previous", growth(nth(latestFirst, 1), nth(latestFirst, 2)));
                break;
            case WEEK:
                metrics.put("YoY", growth(nth(latestFirst, 0), nth(latestFirst, 52)));
                metrics.put("YoY-previous", growth(nth(latestFirst, 1), nth(latestFirst, 53)));
                metrics.put("WoW", growth(nth(latestFirst, 0), nth(latestFirst, 1)));
                metrics.put("WoW-previous", growth(nth(latestFirst, 1), nth(latestFirst, 2)));
                break;
            case DAY:
                metrics.put("DoD", growth(nth(latestFirst, 0), nth(latestFirst, 1)));
                metrics.put("DoD-previous", growth(nth(latestFirst, 1), nth(latestFirst, 2)));
                break;
            default:
                break;
        }
        return metrics;
    }

    private static Double nth(List<Double> values, int n) {
        return n < values.size() ? values.get(n) : null;
    }
}
