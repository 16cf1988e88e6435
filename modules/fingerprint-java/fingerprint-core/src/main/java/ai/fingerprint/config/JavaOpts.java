package ai.fingerprint.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * JVM system properties layer, -Dfingerprint.scale=month.
 * Only fingerprint properties are picked up, so java.home and friends never reach the configuration.
 * Keys are matched case-insensitively and stored lowercase.
 */
public class JavaOpts implements PropertiesSource {

    private static final String PREFIX = "fingerprint.";

    private final Map<String, String> props;

    public JavaOpts() {
        this(new SimpleProps());
    }

    public JavaOpts(PropertiesSource parent) {
        this(parent, System.getProperties());
    }

    public JavaOpts(PropertiesSource parent, Properties systemProperties) {
        Map<String, String> merged = new HashMap<>(parent.values());
        for (String name : systemProperties.stringPropertyNames()) {
            String key = name.toLowerCase(Locale.ROOT);
            if (key.startsWith(PREFIX)) {
                merged.put(key, systemProperties.getProperty(name).trim());
            }
        }
        this.props = Collections.unmodifiableMap(merged);
    }

    @Override
    public Map<String, String> values() {
        return props;
    }

    @Override
    public Optional<String> getValue(String key) {
        return Optional.ofNullable(props.get(key));
    }

}
