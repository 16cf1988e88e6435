package ai.fingerprint.profiles;

import ai.fingerprint.sketch.NumericHistogram;
import ai.fingerprint.types.Field;
import ai.fingerprint.types.TypeSignature;

import java.util.Map;

import static ai.fingerprint.profiles.FingerprintKeys.*;

/**
 * Fingerprint of a text column. Statistics describe the lengths of the values.
 */
public class TextFingerprint extends AbstractFingerprint {

    private final NumericHistogram lengths;

    public TextFingerprint(Field field, NumericHistogram lengths) {
        super(TypeSignature.TEXT, field);
        this.lengths = lengths;
    }

    @Override
    public long getCount() {
        return lengths.totalCount();
    }

    public NumericHistogram getLengths() {
        return lengths;
    }

    @Override
    protected void putStatistics(Map<String, Object> result) {
        result.put(MIN, lengths.minimum());
        result.put(MAX, lengths.maximum());
        result.put(HISTOGRAM, lengths);
        result.put(COUNT, getCount());
        result.put(NIL_PERCENT, share(lengths.nilCount(), getCount()));
        result.put(HAS_NILS, lengths.nilCount() > 0);
    }

    @Override
    public Map<String, Object> toDisplay() {
        Map<String, Object> display = toMap();
        display.put(HISTOGRAM, HistogramDataset.of(getField(), lengths).toMap());
        return display;
    }
}
