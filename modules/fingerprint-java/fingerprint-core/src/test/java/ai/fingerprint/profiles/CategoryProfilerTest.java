package ai.fingerprint.profiles;

import ai.fingerprint.sketch.CategoricalHistogram;
import ai.fingerprint.types.Field;
import ai.fingerprint.types.SemanticType;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static ai.fingerprint.profiles.FingerprintKeys.*;
import static org.hamcrest.MatcherAssert.assertThat;

class CategoryProfilerTest {

    private static final Field STATUS = new Field("STATUS", SemanticType.TEXT, SemanticType.CATEGORY);

    private static CategoryFingerprint profile(List<?> values) {
        return (CategoryFingerprint) new CategoryProfiler().aggregator(ProfilingOptions.defaults(), STATUS).reduce(values);
    }

    @Test
    public void testCategories() {
        Map<String, Object> map = profile(Arrays.asList("open", "closed", "open", null)).toMap();

        assertThat("Wrong count", map.get(COUNT), Matchers.equalTo(4L));
        assertThat("Nil is a category of its own", map.get(CARDINALITY), Matchers.equalTo(3L));
        assertThat("Wrong uniqueness", (Double) map.get(UNIQUENESS), Matchers.closeTo(0.75, 1e-9));
        assertThat("Wrong nil%", (Double) map.get(NIL_PERCENT), Matchers.closeTo(0.25, 1e-9));
        assertThat("Wrong has-nils", map.get(HAS_NILS), Matchers.equalTo(true));
        double expectedEntropy = -(2.0 / 3 * Math.log(2.0 / 3) + 1.0 / 3 * Math.log(1.0 / 3));
        assertThat("Wrong entropy", (Double) map.get(ENTROPY), Matchers.closeTo(expectedEntropy, 1e-9));
    }

    @Test
    public void testDisplay() {
        Map<String, Object> display = profile(Arrays.asList("open", "closed", "open", null)).toDisplay();
        Map<?, ?> histogram = (Map<?, ?>) display.get(HISTOGRAM);

        assertThat("Wrong rows", histogram.get("rows"), Matchers.equalTo(Arrays.asList(
            Arrays.asList("closed", 0.25),
            Arrays.asList("open", 0.5)
        )));
        assertThat("Wrong columns", histogram.get("columns"), Matchers.equalTo(Arrays.asList("STATUS", "SHARE")));
    }

    @Test
    public void testComparisonVector() {
        Map<String, Object> vector = profile(Arrays.asList("a", "b")).toComparisonVector();

        assertThat("Wrong features", vector.keySet(), Matchers.contains(HISTOGRAM, UNIQUENESS, NIL_PERCENT, ENTROPY, COUNT));
    }

    @Test
    public void testAnyValueIsACategory() {
        CategoryFingerprint fingerprint = profile(Arrays.asList(1, 1, 2, true));

        assertThat("Wrong cardinality", fingerprint.getCardinality(), Matchers.equalTo(3L));
        assertThat("Wrong nil%", fingerprint.getNilPercent(), Matchers.equalTo(0.0));
    }

    @Test
    public void testManyDistinctCategories() {
        List<String> values = new ArrayList<>();
        for (int i = 0; i < 20000; i++) {
            values.add("order-" + i);
        }
        CategoryFingerprint fingerprint = profile(values);

        assertThat("Uniqueness is a share", fingerprint.getUniqueness(), Matchers.lessThanOrEqualTo(1.0));
        assertThat("Wrong uniqueness", fingerprint.getUniqueness(), Matchers.closeTo(1.0, 0.05));
    }

    @Test
    public void testUniquenessOfOverestimatedCardinality() {
        CategoricalHistogram histogram = new CategoricalHistogram();
        histogram.insert("open");
        histogram.insert("closed");
        CategoryFingerprint fingerprint = new CategoryFingerprint(STATUS, histogram, 3);

        assertThat("Wrong uniqueness", fingerprint.getUniqueness(), Matchers.equalTo(1.0));
        assertThat("Wrong uniqueness in map", fingerprint.toMap().get(UNIQUENESS), Matchers.equalTo(1.0));
    }
}
