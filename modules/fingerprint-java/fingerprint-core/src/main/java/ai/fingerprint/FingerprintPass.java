package ai.fingerprint;

import ai.fingerprint.aggregate.Aggregator;
import ai.fingerprint.profiles.Fingerprint;

/**
 * One fingerprinting pass. Every value has to be added before the pass is finished, a pass can be
 * finished only once. Not thread safe.
 */
public abstract class FingerprintPass {

    private long added;
    private boolean finished;

    static <A> FingerprintPass of(Aggregator<A, Object, Fingerprint> aggregator) {
        return new Running<>(aggregator);
    }

    public FingerprintPass add(Object value) {
        checkRunning();
        step(value);
        added++;
        return this;
    }

    public Fingerprint finish() {
        checkRunning();
        finished = true;
        return complete();
    }

    public long added() {
        return added;
    }

    protected abstract void step(Object value);

    protected abstract Fingerprint complete();

    private void checkRunning() {
        if (finished) {
            throw new IllegalStateException("Fingerprinting pass is already finished");
        }
    }

    private static class Running<A> extends FingerprintPass {

        private final Aggregator<A, Object, Fingerprint> aggregator;
        private A acc;

        Running(Aggregator<A, Object, Fingerprint> aggregator) {
            this.aggregator = aggregator;
            this.acc = aggregator.init();
        }

        @Override
        protected void step(Object value) {
            acc = aggregator.step(acc, value);
        }

        @Override
        protected Fingerprint complete() {
            return aggregator.complete(acc);
        }
    }
}
