package ai.fingerprint.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Explicitly passed properties, usually the lowest layer of the chain.
 */
public class SimpleProps implements PropertiesSource {

    private final Map<String, String> props;

    public SimpleProps(Map<String, String> props) {
        this.props = new HashMap<>(props);
    }

    public SimpleProps() {
        this.props = Collections.emptyMap();
    }

    public SimpleProps with(String key, String value) {
        Map<String, String> extended = new HashMap<>(props);
        extended.put(key, value);
        return new SimpleProps(extended);
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
