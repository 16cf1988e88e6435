/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package ai.fingerprint.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Environment variables properties source. Vars are passed using uppercase+underscore format:
 * FINGERPRINT__SCALE=month
 */
public class Env implements PropertiesSource {

    private final Map<String, String> props;

    public Env(PropertiesSource parent) {
        this(parent, System.getenv());
    }

    public Env(PropertiesSource parent, Map<String, String> environment) {
        props = new HashMap<>(parent.values());
        props.putAll(new NormalizedProps(environment).values());
    }

    public Env() {
        this(new SimpleProps());
    }

    public Map<String, String> values() {
        return Collections.unmodifiableMap(props);
    }

    @Override
    public Optional<String> getValue(String key) {
        return Optional.ofNullable(props.get(key));
    }
}
