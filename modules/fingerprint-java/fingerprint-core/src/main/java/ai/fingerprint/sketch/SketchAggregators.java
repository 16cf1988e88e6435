package ai.fingerprint.sketch;

import ai.fingerprint.aggregate.Aggregator;

/**
 * Sketches as streaming aggregators.
 */
public final class SketchAggregators {

    private SketchAggregators() {
    }

    public static Aggregator<NumericHistogram, Double, NumericHistogram> numericHistogram(int k) {
        return new Aggregator<NumericHistogram, Double, NumericHistogram>() {
            @Override
            public NumericHistogram init() {
                return new NumericHistogram(k);
            }

            @Override
            public NumericHistogram step(NumericHistogram acc, Double item) {
                return acc.insert(item);
            }

            @Override
            public NumericHistogram complete(NumericHistogram acc) {
                return acc;
            }
        };
    }

    public static Aggregator<CategoricalHistogram, Object, CategoricalHistogram> categoricalHistogram() {
        return new Aggregator<CategoricalHistogram, Object, CategoricalHistogram>() {
            @Override
            public CategoricalHistogram init() {
                return new CategoricalHistogram();
            }

            @Override
            public CategoricalHistogram step(CategoricalHistogram acc, Object item) {
                return acc.insert(item);
            }

            @Override
            public CategoricalHistogram complete(CategoricalHistogram acc) {
                return acc;
            }
        };
    }

    /**
     * Approximate number of distinct values, nil counted as a value.
     */
    public static Aggregator<CardinalitySketch, Object, Long> cardinality(double errorRate) {
        return new Aggregator<CardinalitySketch, Object, Long>() {
            @Override
            public CardinalitySketch init() {
                return new CardinalitySketch(errorRate);
            }

            @Override
            public CardinalitySketch step(CardinalitySketch acc, Object item) {
                return acc.insert(item);
            }

            @Override
            public Long complete(CardinalitySketch acc) {
                return acc.approximateDistinctCount();
            }
        };
    }

    public static Aggregator<CardinalitySketch, Object, Long> cardinality() {
        return cardinality(CardinalitySketch.DEFAULT_ERROR);
    }
}
