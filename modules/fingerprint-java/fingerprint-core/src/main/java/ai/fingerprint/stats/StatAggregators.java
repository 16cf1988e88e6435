package ai.fingerprint.stats;

import ai.fingerprint.aggregate.Aggregator;
import ai.fingerprint.util.Pair;
import org.apache.commons.math3.stat.correlation.StorelessCovariance;
import org.apache.commons.math3.stat.descriptive.StorelessUnivariateStatistic;
import org.apache.commons.math3.stat.descriptive.moment.Kurtosis;
import org.apache.commons.math3.stat.descriptive.moment.Skewness;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.util.function.Supplier;

import static ai.fingerprint.util.Numbers.finiteOrNull;

/**
 * Streaming moment, regression, correlation and covariance estimators. Nils, and pairs with a nil
 * component, are ignored. Results over too few values are missing ({@code null}).
 */
public final class StatAggregators {

    private StatAggregators() {
    }

    /**
     * Excess kurtosis, needs at least 4 values.
     */
    public static Aggregator<StorelessUnivariateStatistic, Double, Double> kurtosis() {
        return univariate(Kurtosis::new);
    }

    /**
     * Needs at least 3 values.
     */
    public static Aggregator<StorelessUnivariateStatistic, Double, Double> skewness() {
        return univariate(Skewness::new);
    }

    public static Aggregator<SimpleRegression, Pair<Double, Double>, LinearRegression> simpleLinearRegression() {
        return new PairedRegression<LinearRegression>() {
            @Override
            public LinearRegression complete(SimpleRegression acc) {
                if (acc.getN() < 2) {
                    return null;
                }
                Double slope = finiteOrNull(acc.getSlope());
                Double intercept = finiteOrNull(acc.getIntercept());
                return slope == null || intercept == null ? null : new LinearRegression(intercept, slope);
            }
        };
    }

    /**
     * Pearson correlation coefficient.
     */
    public static Aggregator<SimpleRegression, Pair<Double, Double>, Double> correlation() {
        return new PairedRegression<Double>() {
            @Override
            public Double complete(SimpleRegression acc) {
                return acc.getN() < 2 ? null : finiteOrNull(acc.getR());
            }
        };
    }

    /**
     * Bias corrected sample covariance.
     */
    public static Aggregator<CovarianceAccumulator, Pair<Double, Double>, Double> covariance() {
        return new Aggregator<CovarianceAccumulator, Pair<Double, Double>, Double>() {
            @Override
            public CovarianceAccumulator init() {
                return new CovarianceAccumulator();
            }

            @Override
            public CovarianceAccumulator step(CovarianceAccumulator acc, Pair<Double, Double> item) {
                if (isComplete(item)) {
                    acc.covariance.increment(new double[]{item.left(), item.right()});
                    acc.n++;
                }
                return acc;
            }

            @Override
            public Double complete(CovarianceAccumulator acc) {
                return acc.n < 2 ? null : finiteOrNull(acc.covariance.getCovariance(0, 1));
            }
        };
    }

    public static final class CovarianceAccumulator {
        private final StorelessCovariance covariance = new StorelessCovariance(2);
        private long n;
    }

    private static boolean isComplete(Pair<Double, Double> item) {
        return item != null && item.left() != null && item.right() != null
            && !item.left().isNaN() && !item.right().isNaN();
    }

    private static Aggregator<StorelessUnivariateStatistic, Double, Double> univariate(Supplier<StorelessUnivariateStatistic> statistic) {
        return new Aggregator<StorelessUnivariateStatistic, Double, Double>() {
            @Override
            public StorelessUnivariateStatistic init() {
                return statistic.get();
            }

            @Override
            public StorelessUnivariateStatistic step(StorelessUnivariateStatistic acc, Double item) {
                if (item != null && !item.isNaN()) {
                    acc.increment(item);
                }
                return acc;
            }

            @Override
            public Double complete(StorelessUnivariateStatistic acc) {
                return finiteOrNull(acc.getResult());
            }
        };
    }

    private abstract static class PairedRegression<R> implements Aggregator<SimpleRegression, Pair<Double, Double>, R> {

        @Override
        public SimpleRegression init() {
            return new SimpleRegression();
        }

        @Override
        public SimpleRegression step(SimpleRegression acc, Pair<Double, Double> item) {
            if (isComplete(item)) {
                acc.addData(item.left(), item.right());
            }
            return acc;
        }
    }
}
