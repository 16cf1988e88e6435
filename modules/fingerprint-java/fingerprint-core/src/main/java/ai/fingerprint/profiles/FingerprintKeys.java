package ai.fingerprint.profiles;

/**
 * Keys of the map views of fingerprints.
 */
public abstract class FingerprintKeys {

    public static final String TYPE = "type";
    public static final String FIELD = "field";
    public static final String COUNT = "count";
    public static final String NIL_PERCENT = "nil%";
    public static final String HAS_NILS = "has-nils";

    public static final String HISTOGRAM = "histogram";
    public static final String PERCENTILES = "percentiles";
    public static final String ENTROPY = "entropy";
    public static final String CARDINALITY = "cardinality";
    public static final String UNIQUENESS = "uniqueness";
    public static final String ALL_DISTINCT = "all-distinct";

    public static final String MIN = "min";
    public static final String MAX = "max";
    public static final String MEAN = "mean";
    public static final String MEDIAN = "median";
    public static final String VAR = "var";
    public static final String SD = "sd";
    public static final String RANGE = "range";
    public static final String KURTOSIS = "kurtosis";
    public static final String SKEWNESS = "skewness";
    public static final String SUM = "sum";
    public static final String SUM_OF_SQUARES = "sum-of-squares";
    public static final String POSITIVE_DEFINITE = "positive-definite";
    public static final String SHARE_ABOVE_MEAN = "%>mean";
    public static final String VAR_ABOVE_SD = "var>sd";
    public static final String UNIT_INTERVAL = "0<=x<=1";
    public static final String SYMMETRIC_UNIT_INTERVAL = "-1<=x<=1";
    public static final String CV = "cv";
    public static final String RANGE_VS_SD = "range-vs-sd";
    public static final String MEAN_MEDIAN_SPREAD = "mean-median-spread";
    public static final String MIN_VS_MAX = "min-vs-max";

    public static final String EARLIEST = "earliest";
    public static final String LATEST = "latest";
    public static final String HISTOGRAM_HOUR = "histogram-hour";
    public static final String HISTOGRAM_DAY = "histogram-day";
    public static final String HISTOGRAM_MONTH = "histogram-month";
    public static final String HISTOGRAM_QUARTER = "histogram-quarter";

    public static final String LINEAR_REGRESSION = "linear-regression";
    public static final String CORRELATION = "correlation";
    public static final String COVARIANCE = "covariance";

    public static final String SCALE = "scale";
    public static final String SERIES = "series";
    public static final String SEASONAL_DECOMPOSITION = "seasonal-decomposition";

}
