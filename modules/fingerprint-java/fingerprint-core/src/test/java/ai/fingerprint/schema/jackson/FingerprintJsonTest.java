package ai.fingerprint.schema.jackson;

import ai.fingerprint.Fingerprinter;
import ai.fingerprint.profiles.Fingerprint;
import ai.fingerprint.profiles.ProfilingOptions;
import ai.fingerprint.profiles.VariantResolver;
import ai.fingerprint.temporal.Scale;
import ai.fingerprint.types.Field;
import ai.fingerprint.types.SemanticType;
import ai.fingerprint.util.Pair;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;

class FingerprintJsonTest {

    private final FingerprintJson json = new FingerprintJson();
    private final ObjectMapper reader = new ObjectMapper();
    private final Fingerprinter fingerprinter = new Fingerprinter(
        ProfilingOptions.builder().scale(Scale.MONTH).build(), new VariantResolver());

    @Test
    public void testNumericFingerprint() throws Exception {
        Fingerprint fingerprint = fingerprinter.fingerprint(Arrays.asList(1, 2, 3, 4, 5, null), Field.of("PRICE", SemanticType.FLOAT));

        JsonNode node = reader.readTree(json.toJson(fingerprint));

        assertThat("Wrong count", node.get("count").asLong(), Matchers.equalTo(6L));
        assertThat("Wrong mean", node.get("mean").asDouble(), Matchers.equalTo(3.0));
        assertThat("Wrong base type", node.get("type").get(0).asText(), Matchers.equalTo("type/Number"));
        assertThat("Wrong special type", node.get("type").get(1).asText(), Matchers.equalTo("type/*"));
        assertThat("Wrong field", node.get("field").get("name").asText(), Matchers.equalTo("PRICE"));
        assertThat("Wrong field type", node.get("field").get("base_type").asText(), Matchers.equalTo("type/Float"));
        assertThat("Histogram should be summarized", node.get("histogram").get("nil-count").asLong(), Matchers.equalTo(1L));
        assertThat("Percentiles should be keyed by rank", node.get("percentiles").has("0.5"), Matchers.equalTo(true));
    }

    @Test
    public void testDisplayDates() throws Exception {
        Fingerprint fingerprint = fingerprinter.fingerprint(
            Arrays.asList("2020-01-06T10:00:00Z", ZonedDateTime.of(2020, 1, 7, 1, 0, 0, 0, ZoneOffset.ofHours(2))),
            Field.of("CREATED_AT", SemanticType.DATE_TIME));

        JsonNode node = reader.readTree(json.toDisplayJson(fingerprint));

        assertThat("Wrong earliest", node.get("earliest").asText(), Matchers.equalTo("2020-01-06T10:00:00.000Z"));
        assertThat("Wrong latest", node.get("latest").asText(), Matchers.equalTo("2020-01-06T23:00:00.000Z"));
        assertThat("Wrong hour columns", node.get("histogram-hour").get("columns").get(0).asText(), Matchers.equalTo("HOUR"));
    }

    @Test
    public void testTimeSeries() throws Exception {
        Fingerprint fingerprint = fingerprinter.fingerprint(
            Arrays.asList(Pair.of(LocalDate.of(2020, 1, 1), 1), Pair.of(LocalDate.of(2020, 2, 1), 3)),
            Field.of("MONTH", SemanticType.DATE), Field.of("REVENUE", SemanticType.FLOAT));

        JsonNode node = reader.readTree(json.toJson(fingerprint));
        JsonNode display = reader.readTree(json.toDisplayJson(fingerprint));

        assertThat("Wrong scale", node.get("scale").asText(), Matchers.equalTo("month"));
        assertThat("Points should be arrays", node.get("series").get(1).get(1).asDouble(), Matchers.equalTo(3.0));
        assertThat("Wrong MoM", node.get("MoM").asDouble(), Matchers.equalTo(2.0));
        assertThat("Pair signature should be an array of tags", node.get("type").get(1).get(0).asText(), Matchers.equalTo("type/Number"));
        assertThat("Both fields should be listed", node.get("field").size(), Matchers.equalTo(2));
        assertThat("Display points should be dated", display.get("series").get(0).get(0).asText(), Matchers.equalTo("2020-01-01T00:00:00.000Z"));
        assertThat("Regression should be an object", node.get("linear-regression").has("slope"), Matchers.equalTo(true));
    }

    @Test
    public void testComparisonVector() throws Exception {
        Fingerprint fingerprint = fingerprinter.fingerprint(Arrays.asList("a", "b", "a"),
            new Field("STATUS", SemanticType.TEXT, SemanticType.CATEGORY));

        JsonNode node = reader.readTree(json.toComparisonJson(fingerprint));

        assertThat("Type is not compared", node.has("type"), Matchers.equalTo(false));
        assertThat("Wrong category count", node.get("histogram").get("categories").get("a").asLong(), Matchers.equalTo(2L));
    }

    @Test
    public void testDefaultFingerprint() throws Exception {
        Fingerprint fingerprint = fingerprinter.fingerprint(Collections.singletonList(null), Field.of("PAYLOAD", SemanticType.DICTIONARY));

        JsonNode node = reader.readTree(json.toJson(fingerprint));

        assertThat("Unclaimed variant should be null", node.get("type").get(0).isNull(), Matchers.equalTo(true));
        assertThat("Wrong signature", node.get("type").get(1).get(0).asText(), Matchers.equalTo("type/Dictionary"));
    }
}
