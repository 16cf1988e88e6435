package ai.fingerprint.profiles;

import ai.fingerprint.types.Field;
import ai.fingerprint.types.TypeSignature;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static ai.fingerprint.profiles.FingerprintKeys.FIELD;
import static ai.fingerprint.profiles.FingerprintKeys.HAS_NILS;
import static ai.fingerprint.profiles.FingerprintKeys.TYPE;

abstract class AbstractFingerprint implements Fingerprint {

    private final List<Field> fields;
    private final TypeSignature type;

    AbstractFingerprint(TypeSignature type, Field... fields) {
        this.type = type;
        this.fields = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(fields)));
    }

    @Override
    public List<Field> getFields() {
        return fields;
    }

    public Field getField() {
        return fields.get(0);
    }

    @Override
    public TypeSignature getType() {
        return type;
    }

    /**
     * Adds the statistics of this variant, in display order.
     */
    protected abstract void putStatistics(Map<String, Object> result);

    protected Object typeValue() {
        return type;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        putStatistics(result);
        result.put(TYPE, typeValue());
        result.put(FIELD, fields.size() == 1 ? fields.get(0) : fields);
        return result;
    }

    @Override
    public Map<String, Object> toDisplay() {
        return toMap();
    }

    @Override
    public Map<String, Object> toComparisonVector() {
        return without(toMap(), TYPE, FIELD, HAS_NILS);
    }

    static Map<String, Object> without(Map<String, Object> map, String... keys) {
        Map<String, Object> result = new LinkedHashMap<>(map);
        for (String key : keys) {
            result.remove(key);
        }
        return result;
    }

    static Map<String, Object> only(Map<String, Object> map, String... keys) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : keys) {
            if (map.containsKey(key)) {
                result.put(key, map.get(key));
            }
        }
        return result;
    }

    static double share(long part, long total) {
        return (double) part / Math.max(total, 1);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + toMap();
    }
}
