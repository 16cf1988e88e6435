package ai.fingerprint;

public abstract class FingerprintPropertyNames {

    /**
     * Temporal bucket granularity used by time series fingerprints: raw, day, week or month.
     */
    public static final String FINGERPRINT__SCALE = "fingerprint.scale";

    /**
     * Maximal query cost: cache, sample, full-scan or joins. Sum-like statistics require full-scan.
     */
    public static final String FINGERPRINT__MAX_COST__QUERY = "fingerprint.max_cost.query";

    /**
     * Maximal computation cost: linear, unbounded or yolo. Seasonal decomposition requires unbounded.
     */
    public static final String FINGERPRINT__MAX_COST__COMPUTATION = "fingerprint.max_cost.computation";

    /**
     * Accuracy parameter of the quantiles sketch backing numeric histograms.
     */
    public static final String FINGERPRINT__HISTOGRAM__K = "fingerprint.histogram.k";

    /**
     * Turn on verbose logging of strategy resolution and skipped statistics.
     */
    public static final String FINGERPRINT__VERBOSE = "fingerprint.verbose";

}
