package ai.fingerprint;

import ai.fingerprint.config.FingerprintConfig;
import ai.fingerprint.config.SimpleProps;
import ai.fingerprint.profiles.DefaultFingerprint;
import ai.fingerprint.profiles.Fingerprint;
import ai.fingerprint.profiles.NumericFingerprint;
import ai.fingerprint.profiles.ProfilingOptions;
import ai.fingerprint.profiles.TimeSeriesFingerprint;
import ai.fingerprint.profiles.VariantResolver;
import ai.fingerprint.temporal.Scale;
import ai.fingerprint.types.Field;
import ai.fingerprint.types.SemanticType;
import ai.fingerprint.types.TypeSignature;
import ai.fingerprint.util.Pair;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;

import static ai.fingerprint.FingerprintPropertyNames.FINGERPRINT__SCALE;
import static ai.fingerprint.FingerprintPropertyNames.FINGERPRINT__VERBOSE;
import static org.hamcrest.MatcherAssert.assertThat;

class FingerprinterTest {

    private static final Field PRICE = Field.of("PRICE", SemanticType.FLOAT);

    private final Fingerprinter fingerprinter = new Fingerprinter(ProfilingOptions.defaults(), new VariantResolver());

    @Test
    public void testResolvesVariant() {
        Fingerprint fingerprint = fingerprinter.fingerprint(Arrays.asList(1.5, 2.5), PRICE);

        assertThat("Wrong variant", fingerprint, Matchers.instanceOf(NumericFingerprint.class));
        assertThat("Wrong type", fingerprint.getType(), Matchers.equalTo(TypeSignature.NUMBER));
        assertThat("Wrong fields", fingerprint.getFields(), Matchers.contains(PRICE));
    }

    @Test
    public void testFallsBackToDefault() {
        Field payload = Field.of("PAYLOAD", SemanticType.ARRAY);

        Fingerprint fingerprint = fingerprinter.fingerprint(Arrays.asList(Arrays.asList(1, 2), null), payload);

        assertThat("Wrong variant", fingerprint, Matchers.instanceOf(DefaultFingerprint.class));
        assertThat("Wrong strategy", fingerprinter.resolveVariant(TypeSignature.of(payload)).name(), Matchers.equalTo("default"));
        assertThat("Wrong count", fingerprint.getCount(), Matchers.equalTo(2L));
    }

    @Test
    public void testPass() {
        FingerprintPass pass = fingerprinter.begin(PRICE);
        pass.add(1).add(2).add(null);

        assertThat("Wrong number of added values", pass.added(), Matchers.equalTo(3L));
        NumericFingerprint fingerprint = (NumericFingerprint) pass.finish();
        assertThat("Wrong max", fingerprint.getMax(), Matchers.equalTo(2.0));

        Assertions.assertThrows(IllegalStateException.class, pass::finish);
        Assertions.assertThrows(IllegalStateException.class, () -> pass.add(3));
    }

    @Test
    public void testFailedValueFailsThePass() {
        FingerprintPass pass = fingerprinter.begin(PRICE);

        Assertions.assertThrows(FingerprintException.class, () -> pass.add("expensive"));
    }

    @Test
    public void testOptionsFromConfig() {
        Fingerprinter configured = new Fingerprinter(new FingerprintConfig(
            new SimpleProps().with(FINGERPRINT__SCALE, "month").with(FINGERPRINT__VERBOSE, "true")));

        Fingerprint fingerprint = configured.fingerprint(
            Arrays.asList(Pair.of(LocalDate.of(2020, 1, 1), 1), Pair.of(LocalDate.of(2020, 3, 1), 2)),
            Field.of("MONTH", SemanticType.DATE), PRICE);

        TimeSeriesFingerprint series = (TimeSeriesFingerprint) fingerprint;
        assertThat("Configured scale should be used", series.getScale(), Matchers.equalTo(Scale.MONTH));
        assertThat("Series should be filled", series.getSeries().size(), Matchers.equalTo(3));
    }

    @Test
    public void testViews() {
        Fingerprint fingerprint = fingerprinter.fingerprint(Arrays.asList(1, 2, 3), PRICE);

        assertThat("Display should equal the fingerprint's", fingerprinter.toDisplay(fingerprint), Matchers.equalTo(fingerprint.toDisplay()));
        assertThat("Wrong comparison vector", fingerprinter.toComparisonVector(fingerprint).containsKey("field"), Matchers.equalTo(false));
    }
}
