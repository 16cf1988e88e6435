package ai.fingerprint.sketch;

import org.apache.datasketches.hll.HllSketch;

/**
 * Approximate distinct count (HyperLogLog). A nil is counted as one more distinct value.
 */
public class CardinalitySketch {

    public static final double DEFAULT_ERROR = 0.01;

    private static final String NIL = "\u0000nil";
    private static final String EMPTY = "\u0000empty";
    private static final int MIN_LG_K = 4;
    private static final int MAX_LG_K = 21;

    private final HllSketch sketch;
    private final double errorRate;

    public CardinalitySketch(double errorRate) {
        if (!(errorRate > 0 && errorRate < 1)) {
            throw new IllegalArgumentException("Error rate should be in (0, 1), got " + errorRate);
        }
        this.errorRate = errorRate;
        this.sketch = new HllSketch(lgKFor(errorRate));
    }

    public CardinalitySketch() {
        this(DEFAULT_ERROR);
    }

    /**
     * Number of HLL buckets (log2) so that the relative standard error 1.04/sqrt(k) stays below {@code errorRate}.
     */
    static int lgKFor(double errorRate) {
        double buckets = Math.pow(1.04 / errorRate, 2);
        int lgK = (int) Math.ceil(Math.log(buckets) / Math.log(2));
        return Math.max(MIN_LG_K, Math.min(MAX_LG_K, lgK));
    }

    public CardinalitySketch insert(Object value) {
        if (value == null) {
            sketch.update(NIL);
        } else if (value instanceof String) {
            String s = (String) value;
            sketch.update(s.isEmpty() ? EMPTY : s);
        } else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            sketch.update(((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            sketch.update(((Number) value).doubleValue());
        } else {
            sketch.update(value.getClass().getName() + ":" + value);
        }
        return this;
    }

    public long approximateDistinctCount() {
        return Math.round(sketch.getEstimate());
    }

    public double getErrorRate() {
        return errorRate;
    }

    public int getLgK() {
        return sketch.getLgConfigK();
    }
}
