package ai.fingerprint.aggregate;

/**
 * Streaming fold over one pass of items.
 * <p>
 * {@link #step} must observe every item before {@link #complete} is called. Accumulators may be
 * mutable, in which case {@code step} returns the instance it was given.
 *
 * @param <A> accumulator
 * @param <T> item
 * @param <R> result
 */
public interface Aggregator<A, T, R> {

    A init();

    A step(A acc, T item);

    R complete(A acc);

    /**
     * Folds all items in one pass.
     */
    default R reduce(Iterable<? extends T> items) {
        A acc = init();
        for (T item : items) {
            acc = step(acc, item);
        }
        return complete(acc);
    }
}
