package ai.fingerprint.temporal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Additive split of a series into trend, seasonal component and remainder. Points where the trend
 * is undefined hold null in the trend and the remainder.
 */
public class SeasonalDecomposition {

    private final int period;
    private final List<Double> trend;
    private final List<Double> seasonal;
    private final List<Double> remainder;

    public SeasonalDecomposition(int period, List<Double> trend, List<Double> seasonal, List<Double> remainder) {
        this.period = period;
        this.trend = Collections.unmodifiableList(trend);
        this.seasonal = Collections.unmodifiableList(seasonal);
        this.remainder = Collections.unmodifiableList(remainder);
    }

    @JsonProperty("period")
    public int getPeriod() {
        return period;
    }

    @JsonProperty("trend")
    public List<Double> getTrend() {
        return trend;
    }

    @JsonProperty("seasonal")
    public List<Double> getSeasonal() {
        return seasonal;
    }

    @JsonProperty("remainder")
    public List<Double> getRemainder() {
        return remainder;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>(3);
        result.put("trend", trend);
        result.put("seasonal", seasonal);
        result.put("remainder", remainder);
        return result;
    }
}
