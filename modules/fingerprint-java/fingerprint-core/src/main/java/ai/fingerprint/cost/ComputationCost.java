package ai.fingerprint.cost;

import java.util.Locale;

/**
 * How expensive the algorithms run over the collected values may be.
 */
public enum ComputationCost {

    LINEAR("linear"),
    UNBOUNDED("unbounded"),
    YOLO("yolo");

    private final String propertyValue;

    ComputationCost(String propertyValue) {
        this.propertyValue = propertyValue;
    }

    public String propertyValue() {
        return propertyValue;
    }

    public static ComputationCost fromPropertyValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ComputationCost cost : values()) {
            if (cost.propertyValue.equals(normalized)) {
                return cost;
            }
        }
        throw new IllegalArgumentException(String.format("Unknown computation cost '%s'", value));
    }
}
