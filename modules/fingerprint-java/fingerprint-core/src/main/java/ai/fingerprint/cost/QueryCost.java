package ai.fingerprint.cost;

import java.util.Locale;

/**
 * How much of the underlying table a statistic is allowed to look at.
 */
public enum QueryCost {

    CACHE("cache"),
    SAMPLE("sample"),
    FULL_SCAN("full-scan"),
    JOINS("joins");

    private final String propertyValue;

    QueryCost(String propertyValue) {
        this.propertyValue = propertyValue;
    }

    public String propertyValue() {
        return propertyValue;
    }

    public static QueryCost fromPropertyValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (QueryCost cost : values()) {
            if (cost.propertyValue.equals(normalized)) {
                return cost;
            }
        }
        throw new IllegalArgumentException(String.format("Unknown query cost '%s'", value));
    }
}
