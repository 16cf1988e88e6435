package ai.fingerprint.profiles;

import ai.fingerprint.bins.Histograms;
import ai.fingerprint.sketch.CategoricalHistogram;
import ai.fingerprint.sketch.NumericHistogram;
import ai.fingerprint.temporal.Periodicity;
import ai.fingerprint.temporal.Timestamps;
import ai.fingerprint.types.Field;
import ai.fingerprint.types.SemanticType;
import ai.fingerprint.types.TypeSignature;

import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import static ai.fingerprint.profiles.FingerprintKeys.*;

/**
 * Fingerprint of a date-time column. Instants are kept as epoch milliseconds until rendered.
 */
public class DateTimeFingerprint extends AbstractFingerprint {

    static final Field HOUR = new Field("HOUR", "Hour of day", null, SemanticType.INTEGER, SemanticType.CATEGORY);
    static final Field DAY = new Field("DAY", "Day of week", null, SemanticType.INTEGER, SemanticType.CATEGORY);
    static final Field MONTH = new Field("MONTH", "Month of year", null, SemanticType.INTEGER, SemanticType.CATEGORY);
    static final Field QUARTER = new Field("QUARTER", "Quarter of year", null, SemanticType.INTEGER, SemanticType.CATEGORY);

    private final NumericHistogram histogram;
    private final Map<Double, Double> percentiles;
    private final CategoricalHistogram hours;
    private final CategoricalHistogram days;
    private final CategoricalHistogram months;
    private final CategoricalHistogram quarters;

    public DateTimeFingerprint(Field field,
                               NumericHistogram histogram,
                               CategoricalHistogram hours,
                               CategoricalHistogram days,
                               CategoricalHistogram months,
                               CategoricalHistogram quarters) {
        super(TypeSignature.DATE_TIME, field);
        this.histogram = histogram;
        this.percentiles = histogram.percentiles(NumericProfiler.PERCENTILES);
        this.hours = hours;
        this.days = days;
        this.months = months;
        this.quarters = quarters;
    }

    @Override
    public long getCount() {
        return histogram.totalCount();
    }

    /**
     * Epoch milliseconds of the earliest value, null for a column without values.
     */
    public Double getEarliest() {
        return histogram.minimum();
    }

    public Double getLatest() {
        return histogram.maximum();
    }

    public NumericHistogram getHistogram() {
        return histogram;
    }

    public CategoricalHistogram getHours() {
        return hours;
    }

    public CategoricalHistogram getDays() {
        return days;
    }

    public CategoricalHistogram getMonths() {
        return months;
    }

    public CategoricalHistogram getQuarters() {
        return quarters;
    }

    @Override
    protected void putStatistics(Map<String, Object> result) {
        result.put(EARLIEST, getEarliest());
        result.put(LATEST, getLatest());
        result.put(HISTOGRAM, histogram);
        result.put(PERCENTILES, percentiles);
        result.put(HISTOGRAM_HOUR, hours);
        result.put(HISTOGRAM_DAY, days);
        result.put(HISTOGRAM_MONTH, months);
        result.put(HISTOGRAM_QUARTER, quarters);
        result.put(COUNT, getCount());
        result.put(NIL_PERCENT, share(histogram.nilCount(), getCount()));
        result.put(HAS_NILS, histogram.nilCount() > 0);
        result.put(ENTROPY, Histograms.entropy(histogram));
    }

    @Override
    public Map<String, Object> toDisplay() {
        ZonedDateTime earliest = toDateTime(getEarliest());
        ZonedDateTime latest = toDateTime(getLatest());

        Map<String, Object> display = toMap();
        display.put(EARLIEST, earliest);
        display.put(LATEST, latest);
        display.put(HISTOGRAM, HistogramDataset.of(DateTimeFingerprint::toDateTime, getField(), histogram).toMap());

        Map<Double, ZonedDateTime> displayPercentiles = new LinkedHashMap<>(percentiles.size());
        percentiles.forEach((rank, value) -> displayPercentiles.put(rank, toDateTime(value)));
        display.put(PERCENTILES, displayPercentiles);

        display.put(HISTOGRAM_HOUR, HistogramDataset.of(HOUR, hours).toMap());
        display.put(HISTOGRAM_DAY, HistogramDataset.of(DAY, days).toMap());

        HistogramDataset monthDataset = HistogramDataset.of(MONTH, months);
        HistogramDataset quarterDataset = HistogramDataset.of(QUARTER, quarters);
        if (earliest != null) {
            monthDataset = monthDataset.withRows(
                Periodicity.weigh(Periodicity.monthFrequencies(earliest, latest), monthDataset.getRows()));
            quarterDataset = quarterDataset.withRows(
                Periodicity.weigh(Periodicity.quarterFrequencies(earliest, latest), quarterDataset.getRows()));
        }
        display.put(HISTOGRAM_MONTH, monthDataset.toMap());
        display.put(HISTOGRAM_QUARTER, quarterDataset.toMap());
        return display;
    }

    @Override
    public Map<String, Object> toComparisonVector() {
        return without(toMap(), TYPE, PERCENTILES, FIELD, HAS_NILS);
    }

    private static ZonedDateTime toDateTime(Object epochMillis) {
        return epochMillis == null ? null : Timestamps.fromEpochMillis(((Number) epochMillis).doubleValue());
    }
}
