/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package ai.fingerprint.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Normalizes properties. FINGERPRINT__MAX_COST__QUERY to fingerprint.max_cost.query.
 */
public class NormalizedProps implements PropertiesSource {

    private static final String PREFIX = "fingerprint";

    private final Map<String, String> props;

    public NormalizedProps(Map<String, String> propsToNormalize) {
        props = new HashMap<>();
        for (Map.Entry<String, String> prop : propsToNormalize.entrySet()) {
            String key = prop.getKey();
            if (key.toLowerCase(Locale.ROOT).startsWith(PREFIX)) {
                String normalizedKey = key.replace("__", ".").toLowerCase(Locale.ROOT);
                props.put(normalizedKey, prop.getValue().trim());
            } else {
                props.put(key, prop.getValue());
            }
        }
    }

    @Override
    public Map<String, String> values() {
        return Collections.unmodifiableMap(props);
    }

    @Override
    public Optional<String> getValue(String key) {
        return Optional.ofNullable(props.get(key));
    }

}
