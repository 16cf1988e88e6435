package ai.fingerprint.profiles;

import ai.fingerprint.types.Field;
import ai.fingerprint.types.TypeSignature;

import java.util.Arrays;
import java.util.Map;

import static ai.fingerprint.profiles.FingerprintKeys.*;

/**
 * Fingerprint of a column no other variant handles: only counts are tracked.
 */
public class DefaultFingerprint extends AbstractFingerprint {

    private final long count;
    private final long nilCount;

    public DefaultFingerprint(TypeSignature type, long count, long nilCount, Field... fields) {
        super(type, fields);
        this.count = count;
        this.nilCount = nilCount;
    }

    @Override
    public long getCount() {
        return count;
    }

    public long getNilCount() {
        return nilCount;
    }

    @Override
    protected void putStatistics(Map<String, Object> result) {
        result.put(COUNT, count);
        result.put(NIL_PERCENT, share(nilCount, count));
        result.put(HAS_NILS, nilCount > 0);
    }

    // no variant claimed the signature
    @Override
    protected Object typeValue() {
        return Arrays.asList(null, getType());
    }
}
