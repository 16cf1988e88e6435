package ai.fingerprint.aggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Combinators building aggregators out of other aggregators.
 */
public final class Aggregators {

    private Aggregators() {
    }

    /**
     * Feeds every item to each of the named aggregators. Every aggregator observes exactly the same items.
     */
    public static <T> Aggregator<Map<String, Object>, T, FusedResult> fuse(Map<String, ? extends Aggregator<?, ? super T, ?>> aggregators) {
        if (aggregators.isEmpty()) {
            throw new IllegalArgumentException("Nothing to fuse");
        }
        Map<String, Aggregator<Object, T, Object>> children = new LinkedHashMap<>(aggregators.size());
        for (Map.Entry<String, ? extends Aggregator<?, ? super T, ?>> entry : aggregators.entrySet()) {
            children.put(entry.getKey(), erase(entry.getValue()));
        }
        return new Fused<>(children);
    }

    /**
     * Applies {@code f} to each item before it is stepped into {@code aggregator}.
     */
    public static <A, T, U, R> Aggregator<A, T, R> preStep(Function<? super T, ? extends U> f, Aggregator<A, ? super U, R> aggregator) {
        Objects.requireNonNull(f, "f");
        return new Aggregator<A, T, R>() {
            @Override
            public A init() {
                return aggregator.init();
            }

            @Override
            public A step(A acc, T item) {
                return aggregator.step(acc, f.apply(item));
            }

            @Override
            public R complete(A acc) {
                return aggregator.complete(acc);
            }
        };
    }

    /**
     * Applies {@code g} to the finalized result of {@code aggregator}.
     */
    public static <A, T, R, S> Aggregator<A, T, S> postComplete(Aggregator<A, T, R> aggregator, Function<? super R, ? extends S> g) {
        Objects.requireNonNull(g, "g");
        return new Aggregator<A, T, S>() {
            @Override
            public A init() {
                return aggregator.init();
            }

            @Override
            public A step(A acc, T item) {
                return aggregator.step(acc, item);
            }

            @Override
            public S complete(A acc) {
                return g.apply(aggregator.complete(acc));
            }
        };
    }

    /**
     * Steps only the items matching {@code predicate} into {@code aggregator}.
     */
    public static <A, T, R> Aggregator<A, T, R> withFilter(Predicate<? super T> predicate, Aggregator<A, T, R> aggregator) {
        return new Aggregator<A, T, R>() {
            @Override
            public A init() {
                return aggregator.init();
            }

            @Override
            public A step(A acc, T item) {
                return predicate.test(item) ? aggregator.step(acc, item) : acc;
            }

            @Override
            public R complete(A acc) {
                return aggregator.complete(acc);
            }
        };
    }

    /**
     * Number of items, nils included.
     */
    public static <T> Aggregator<long[], T, Long> count() {
        return new Aggregator<long[], T, Long>() {
            @Override
            public long[] init() {
                return new long[1];
            }

            @Override
            public long[] step(long[] acc, T item) {
                acc[0]++;
                return acc;
            }

            @Override
            public Long complete(long[] acc) {
                return acc[0];
            }
        };
    }

    /**
     * Sum of the non-nil numbers.
     */
    public static Aggregator<double[], Number, Double> sum() {
        return new Aggregator<double[], Number, Double>() {
            @Override
            public double[] init() {
                return new double[1];
            }

            @Override
            public double[] step(double[] acc, Number item) {
                if (item != null) {
                    acc[0] += item.doubleValue();
                }
                return acc;
            }

            @Override
            public Double complete(double[] acc) {
                return acc[0];
            }
        };
    }

    /**
     * All items in arrival order.
     */
    public static <T> Aggregator<List<T>, T, List<T>> collect() {
        return new Aggregator<List<T>, T, List<T>>() {
            @Override
            public List<T> init() {
                return new ArrayList<>();
            }

            @Override
            public List<T> step(List<T> acc, T item) {
                acc.add(item);
                return acc;
            }

            @Override
            public List<T> complete(List<T> acc) {
                return Collections.unmodifiableList(acc);
            }
        };
    }

    /**
     * Groups items by {@code groupFn} and folds each group with its own accumulator of {@code aggregator}.
     * The grouping map is local to the pass and handed out unmodifiable.
     */
    public static <A, T, K, R> Aggregator<Map<K, A>, T, Map<K, R>> rollup(Aggregator<A, ? super T, R> aggregator, Function<? super T, ? extends K> groupFn) {
        return new Aggregator<Map<K, A>, T, Map<K, R>>() {
            @Override
            public Map<K, A> init() {
                return new LinkedHashMap<>();
            }

            @Override
            public Map<K, A> step(Map<K, A> acc, T item) {
                K key = groupFn.apply(item);
                A group = acc.containsKey(key) ? acc.get(key) : aggregator.init();
                acc.put(key, aggregator.step(group, item));
                return acc;
            }

            @Override
            public Map<K, R> complete(Map<K, A> acc) {
                Map<K, R> result = new LinkedHashMap<>(acc.size());
                for (Map.Entry<K, A> group : acc.entrySet()) {
                    result.put(group.getKey(), aggregator.complete(group.getValue()));
                }
                return Collections.unmodifiableMap(result);
            }
        };
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static <T> Aggregator<Object, T, Object> erase(Aggregator<?, ? super T, ?> aggregator) {
        return (Aggregator<Object, T, Object>) (Aggregator) aggregator;
    }

    private static class Fused<T> implements Aggregator<Map<String, Object>, T, FusedResult> {

        private final Map<String, Aggregator<Object, T, Object>> children;

        Fused(Map<String, Aggregator<Object, T, Object>> children) {
            this.children = children;
        }

        @Override
        public Map<String, Object> init() {
            Map<String, Object> states = new HashMap<>(children.size());
            for (Map.Entry<String, Aggregator<Object, T, Object>> child : children.entrySet()) {
                states.put(child.getKey(), child.getValue().init());
            }
            return states;
        }

        @Override
        public Map<String, Object> step(Map<String, Object> acc, T item) {
            for (Map.Entry<String, Aggregator<Object, T, Object>> child : children.entrySet()) {
                acc.put(child.getKey(), child.getValue().step(acc.get(child.getKey()), item));
            }
            return acc;
        }

        @Override
        public FusedResult complete(Map<String, Object> acc) {
            Map<String, Object> results = new LinkedHashMap<>(children.size());
            for (Map.Entry<String, Aggregator<Object, T, Object>> child : children.entrySet()) {
                results.put(child.getKey(), child.getValue().complete(acc.get(child.getKey())));
            }
            return new FusedResult(results);
        }
    }
}
