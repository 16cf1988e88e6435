package ai.fingerprint.aggregate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Finalized results of fused aggregators, keyed by aggregator name.
 */
public class FusedResult {

    private final Map<String, Object> results;

    FusedResult(Map<String, Object> results) {
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    @SuppressWarnings("unchecked")
    public <R> R get(String name) {
        if (!results.containsKey(name)) {
            throw new IllegalArgumentException(String.format("No aggregator named '%s', known: %s", name, results.keySet()));
        }
        return (R) results.get(name);
    }

    public Set<String> names() {
        return results.keySet();
    }

    public Map<String, Object> toMap() {
        return results;
    }

    @Override
    public String toString() {
        return results.toString();
    }
}
