package ai.fingerprint.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Least squares fit y = intercept + slope * x.
 */
public class LinearRegression {

    private final double intercept;
    private final double slope;

    public LinearRegression(double intercept, double slope) {
        this.intercept = intercept;
        this.slope = slope;
    }

    @JsonProperty("intercept")
    public double getIntercept() {
        return intercept;
    }

    @JsonProperty("slope")
    public double getSlope() {
        return slope;
    }

    public double predict(double x) {
        return intercept + slope * x;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>(2);
        result.put("intercept", intercept);
        result.put("slope", slope);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearRegression that = (LinearRegression) o;
        return Double.compare(that.intercept, intercept) == 0 && Double.compare(that.slope, slope) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(intercept, slope);
    }

    @Override
    public String toString() {
        return "LinearRegression" + toMap();
    }
}
