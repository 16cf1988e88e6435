package ai.fingerprint.profiles;

import ai.fingerprint.stats.LinearRegression;
import ai.fingerprint.types.Field;
import ai.fingerprint.types.TypeSignature;

import java.util.Map;

import static ai.fingerprint.profiles.FingerprintKeys.*;

/**
 * Relationship between two numeric columns. Statistics are null when fewer than two complete pairs were seen.
 */
public class NumberPairFingerprint extends AbstractFingerprint {

    private final long count;
    private final LinearRegression linearRegression;
    private final Double correlation;
    private final Double covariance;

    public NumberPairFingerprint(Field x, Field y,
                                 long count,
                                 LinearRegression linearRegression,
                                 Double correlation,
                                 Double covariance) {
        super(TypeSignature.NUMBER_NUMBER, x, y);
        this.count = count;
        this.linearRegression = linearRegression;
        this.correlation = correlation;
        this.covariance = covariance;
    }

    @Override
    public long getCount() {
        return count;
    }

    public LinearRegression getLinearRegression() {
        return linearRegression;
    }

    public Double getCorrelation() {
        return correlation;
    }

    public Double getCovariance() {
        return covariance;
    }

    @Override
    protected void putStatistics(Map<String, Object> result) {
        result.put(LINEAR_REGRESSION, linearRegression);
        result.put(CORRELATION, correlation);
        result.put(COVARIANCE, covariance);
        result.put(COUNT, count);
    }
}
