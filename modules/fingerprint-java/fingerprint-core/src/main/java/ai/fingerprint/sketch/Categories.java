package ai.fingerprint.sketch;

import java.util.Collection;
import java.util.Comparator;
import java.util.Map;

final class Categories {

    private static final Comparator<Map.Entry<Object, Long>> NUMERIC =
        Comparator.comparingDouble(e -> ((Number) e.getKey()).doubleValue());

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static final Comparator<Map.Entry<Object, Long>> NATURAL =
        (a, b) -> ((Comparable) a.getKey()).compareTo(b.getKey());

    private static final Comparator<Map.Entry<Object, Long>> BY_COUNT =
        Comparator.<Map.Entry<Object, Long>>comparingLong(Map.Entry::getValue)
            .reversed()
            .thenComparing(e -> e.getKey().toString());

    private Categories() {
    }

    /**
     * Numbers by value, keys of one comparable class naturally, anything else by descending count.
     */
    static Comparator<Map.Entry<Object, Long>> orderFor(Collection<Object> keys) {
        boolean allNumbers = true;
        Class<?> keyClass = null;
        boolean sameComparableClass = true;
        for (Object key : keys) {
            allNumbers &= key instanceof Number;
            if (keyClass == null) {
                keyClass = key.getClass();
            }
            sameComparableClass &= key instanceof Comparable && key.getClass().equals(keyClass);
        }
        if (allNumbers) {
            return NUMERIC;
        }
        return sameComparableClass ? NATURAL : BY_COUNT;
    }
}
