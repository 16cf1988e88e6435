package ai.fingerprint.temporal;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Period;
import java.util.Locale;

/**
 * Temporal bucket granularity of a time series.
 */
public enum Scale {

    RAW("raw", null, 0),
    DAY("day", Period.ofDays(1), 365),
    WEEK("week", Period.ofWeeks(1), 52),
    MONTH("month", Period.ofMonths(1), 12);

    private final String propertyValue;
    private final Period step;
    private final int seasonalPeriod;

    Scale(String propertyValue, Period step, int seasonalPeriod) {
        this.propertyValue = propertyValue;
        this.step = step;
        this.seasonalPeriod = seasonalPeriod;
    }

    @JsonValue
    public String propertyValue() {
        return propertyValue;
    }

    /**
     * Distance between two consecutive points of a gap-filled series, null for raw series.
     */
    public Period step() {
        return step;
    }

    /**
     * Number of periods in one seasonal cycle (a year).
     */
    public int seasonalPeriod() {
        return seasonalPeriod;
    }

    public boolean isRaw() {
        return this == RAW;
    }

    public static Scale fromPropertyValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Scale scale : values()) {
            if (scale.propertyValue.equals(normalized)) {
                return scale;
            }
        }
        throw new IllegalArgumentException(String.format("Unknown scale '%s'", value));
    }
}
