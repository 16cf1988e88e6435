package ai.fingerprint.profiles;

import ai.fingerprint.bins.Histograms;
import ai.fingerprint.sketch.CategoricalHistogram;
import ai.fingerprint.types.Field;
import ai.fingerprint.types.TypeSignature;

import java.util.Map;

import static ai.fingerprint.profiles.FingerprintKeys.*;

public class CategoryFingerprint extends AbstractFingerprint {

    private final CategoricalHistogram histogram;
    private final long cardinality;

    public CategoryFingerprint(Field field, CategoricalHistogram histogram, long cardinality) {
        super(TypeSignature.CATEGORY, field);
        this.histogram = histogram;
        this.cardinality = cardinality;
    }

    @Override
    public long getCount() {
        return histogram.totalCount();
    }

    public CategoricalHistogram getHistogram() {
        return histogram;
    }

    public long getCardinality() {
        return cardinality;
    }

    public double getUniqueness() {
        return Math.min(1.0, share(cardinality, getCount()));
    }

    public double getNilPercent() {
        return share(histogram.nilCount(), getCount());
    }

    @Override
    protected void putStatistics(Map<String, Object> result) {
        result.put(HISTOGRAM, histogram);
        result.put(UNIQUENESS, getUniqueness());
        result.put(NIL_PERCENT, getNilPercent());
        result.put(HAS_NILS, histogram.nilCount() > 0);
        result.put(CARDINALITY, cardinality);
        result.put(ENTROPY, Histograms.entropy(histogram));
        result.put(COUNT, getCount());
    }

    @Override
    public Map<String, Object> toDisplay() {
        Map<String, Object> display = toMap();
        display.put(HISTOGRAM, HistogramDataset.of(getField(), histogram).toMap());
        return display;
    }

    @Override
    public Map<String, Object> toComparisonVector() {
        return without(toMap(), TYPE, CARDINALITY, FIELD, HAS_NILS);
    }
}
