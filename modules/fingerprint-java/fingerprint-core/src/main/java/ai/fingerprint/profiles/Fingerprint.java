package ai.fingerprint.profiles;

import ai.fingerprint.types.Field;
import ai.fingerprint.types.TypeSignature;

import java.util.List;
import java.util.Map;

/**
 * Statistical profile of a column, or a pair of columns, produced by one pass over its values.
 * Fingerprints are immutable; renderings are new maps.
 */
public interface Fingerprint {

    /**
     * Profiled columns, two for bivariate fingerprints.
     */
    List<Field> getFields();

    TypeSignature getType();

    long getCount();

    /**
     * Every statistic of the fingerprint, keyed by {@link FingerprintKeys}.
     */
    Map<String, Object> toMap();

    /**
     * Human readable rendering (x-ray): sketches become tables, internal flags are dropped.
     */
    Map<String, Object> toDisplay();

    /**
     * Features used to compare fingerprints with each other.
     */
    Map<String, Object> toComparisonVector();

}
