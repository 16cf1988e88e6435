package ai.fingerprint.bins;

import ai.fingerprint.sketch.CategoricalHistogram;
import ai.fingerprint.sketch.NumericHistogram;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;

class HistogramsTest {

    private static NumericHistogram numbers(Double... values) {
        NumericHistogram histogram = new NumericHistogram(200);
        for (Double value : values) {
            histogram.insert(value);
        }
        return histogram;
    }

    @Test
    public void testNumericBins() {
        List<Bin> bins = Histograms.equidistantBins(numbers(1.0, 2.0, 3.0, 4.0, 5.0, null));

        assertThat("Wrong number of bins", bins.size(), Matchers.equalTo(2));
        assertThat("Wrong first bound", (Double) bins.get(0).getKey(), Matchers.closeTo(0, 1e-9));
        assertThat("Wrong second bound", (Double) bins.get(1).getKey(), Matchers.closeTo(3, 1e-9));
        assertThat("Wrong first count", bins.get(0).getCount(), Matchers.equalTo(2.0));
        assertThat("Maximum should be in the last bin", bins.get(1).getCount(), Matchers.equalTo(3.0));
    }

    @Test
    public void testBinsCountEveryValue() {
        NumericHistogram histogram = new NumericHistogram(200);
        for (int i = 0; i < 150; i++) {
            histogram.insert(Math.sin(i) * 100 + i);
        }
        double total = 0;
        for (Bin bin : Histograms.equidistantBins(histogram)) {
            total += bin.getCount();
            assertThat("Negative bin count", bin.getCount(), Matchers.greaterThanOrEqualTo(0.0));
        }
        assertThat("Bins should add up to the number of values", total, Matchers.equalTo(150.0));
    }

    @Test
    public void testConstantColumn() {
        NumericHistogram histogram = numbers(5.0, 5.0, 5.0);

        List<Bin> bins = Histograms.equidistantBins(histogram);

        assertThat("Wrong unit width", Histograms.optimalBinWidth(histogram), Matchers.equalTo(1.0));
        assertThat("Wrong number of bins", bins.size(), Matchers.equalTo(1));
        assertThat("Wrong count", bins.get(0).getCount(), Matchers.equalTo(3.0));
        assertThat("Wrong entropy", Histograms.entropy(histogram), Matchers.equalTo(0.0));
    }

    @Test
    public void testSingleValue() {
        NumericHistogram histogram = numbers(42.0, null);

        List<Bin> bins = Histograms.equidistantBins(histogram);

        assertThat("Wrong unit width", Histograms.optimalBinWidth(histogram), Matchers.equalTo(1.0));
        assertThat("Wrong number of bins", bins.size(), Matchers.equalTo(1));
        assertThat("Wrong count", bins.get(0).getCount(), Matchers.equalTo(1.0));
    }

    @Test
    public void testEmptyHistogram() {
        NumericHistogram histogram = numbers(null, null);

        assertThat("Empty histogram has no bins", Histograms.equidistantBins(histogram), Matchers.empty());
        assertThat("Empty histogram has no width", Histograms.optimalBinWidth(histogram), Matchers.nullValue());
        assertThat("Wrong entropy", Histograms.entropy(histogram), Matchers.equalTo(0.0));
    }

    @Test
    public void testCategoricalBins() {
        CategoricalHistogram histogram = new CategoricalHistogram()
            .insert("b").insert("a").insert("b").insert("a").insert(null);

        List<Bin> bins = Histograms.equidistantBins(histogram);

        assertThat("Wrong bins", bins, Matchers.contains(new Bin("a", 2), new Bin("b", 2)));
        assertThat("Wrong entropy", Histograms.entropy(histogram), Matchers.closeTo(Math.log(2), 1e-12));
        assertThat("Categories have no bin width", Histograms.optimalBinWidth(histogram), Matchers.nullValue());
    }

    @Test
    public void testExtentOverflowingADouble() {
        NumericHistogram histogram = numbers(-1e308, 1e308, 0.0, null);

        List<Bin> bins = Histograms.equidistantBins(histogram);

        assertThat("Overflowing extent has no bin width", Histograms.optimalBinWidth(histogram), Matchers.nullValue());
        assertThat("Wrong number of bins", bins.size(), Matchers.equalTo(1));
        assertThat("Single bin starts at the minimum", (Double) bins.get(0).getKey(), Matchers.equalTo(-1e308));
        assertThat("Single bin holds every value", bins.get(0).getCount(), Matchers.equalTo(3.0));
        assertThat("Single bin has no entropy", Histograms.entropy(histogram), Matchers.equalTo(0.0));
    }
}
