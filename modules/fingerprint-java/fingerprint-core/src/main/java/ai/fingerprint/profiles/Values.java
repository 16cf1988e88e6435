package ai.fingerprint.profiles;

import ai.fingerprint.FingerprintException;
import ai.fingerprint.temporal.Timestamps;
import ai.fingerprint.types.Field;
import ai.fingerprint.util.Numbers;
import ai.fingerprint.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Coerces streamed values for a field, failing the whole pass on a value of the wrong kind.
 */
final class Values {

    private static final Logger LOG = LoggerFactory.getLogger(Values.class);

    private Values() {
    }

    static Double number(Field field, Object value) {
        try {
            return Numbers.toDouble(value);
        } catch (ClassCastException e) {
            throw failure(field, value, "a number", e);
        }
    }

    /**
     * Non-finite numbers are nils.
     */
    static Double finiteNumber(Field field, Object value) {
        Double number = number(field, value);
        return number == null || number.isNaN() || number.isInfinite() ? null : number;
    }

    static Double length(Field field, Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof CharSequence)) {
            throw failure(field, value, "a text", new ClassCastException(value.getClass().getName()));
        }
        return (double) ((CharSequence) value).length();
    }

    static Double epochMillis(Field field, Object value) {
        try {
            return Timestamps.toEpochMillis(value);
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw failure(field, value, "a date or date-time", e);
        }
    }

    /**
     * Items of bivariate fingerprints: {@link Pair}, a two element {@link List} or a two element array.
     */
    static Pair<Object, Object> pair(Object item) {
        if (item instanceof Pair) {
            Pair<?, ?> pair = (Pair<?, ?>) item;
            return Pair.of(pair.left(), pair.right());
        }
        if (item instanceof List && ((List<?>) item).size() == 2) {
            List<?> list = (List<?>) item;
            return Pair.of(list.get(0), list.get(1));
        }
        if (item instanceof Object[] && ((Object[]) item).length == 2) {
            Object[] array = (Object[]) item;
            return Pair.of(array[0], array[1]);
        }
        throw new FingerprintException(String.format("Expected a pair of values, got %s", item));
    }

    /**
     * Checks that a strategy is given as many fields as it profiles.
     */
    static void requireArity(String strategy, int arity, Field... fields) {
        if (fields == null || fields.length != arity) {
            throw new IllegalArgumentException(String.format(
                "%s profiles %d field(s), got %d", strategy, arity, fields == null ? 0 : fields.length));
        }
        for (Field field : fields) {
            Objects.requireNonNull(field, "field");
        }
    }

    private static FingerprintException failure(Field field, Object value, String expected, Exception cause) {
        String message = String.format("Value '%s' of field %s is not %s", value, field.getName(), expected);
        LOG.error(message);
        return new FingerprintException(message, cause);
    }
}
