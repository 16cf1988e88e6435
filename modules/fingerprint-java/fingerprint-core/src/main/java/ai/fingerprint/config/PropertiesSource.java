/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package ai.fingerprint.config;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

public interface PropertiesSource {

    Map<String, String> values();

    Optional<String> getValue(String key);

    default boolean isTrue(String key) {
        return getValue(key).map(v -> Boolean.parseBoolean(v.trim())).orElse(false);
    }

    default int getInt(String key, int defaultValue) {
        Optional<String> value = getValue(key);
        if (!value.isPresent()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.get().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Property %s should be an integer, got '%s'", key, value.get()), e);
        }
    }

    /**
     * Parses a present value, an {@link IllegalArgumentException} from the parser is rethrown naming the property.
     */
    default <T> Optional<T> getParsed(String key, Function<String, T> parser) {
        return getValue(key).map(value -> {
            try {
                return parser.apply(value);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(String.format("Invalid value of property %s: %s", key, e.getMessage()), e);
            }
        });
    }

}
