package ai.fingerprint.profiles;

import ai.fingerprint.types.Field;
import ai.fingerprint.types.SemanticType;
import ai.fingerprint.types.TypeSignature;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;

class VariantResolverTest {

    private final VariantResolver resolver = new VariantResolver();

    private String variantOf(Field... fields) {
        return resolver.resolve(TypeSignature.of(fields)).map(ProfilerStrategy::name).orElse(null);
    }

    @Test
    public void testSingleFields() {
        assertThat("Integer", variantOf(Field.of("A", SemanticType.INTEGER)), Matchers.equalTo("numeric"));
        assertThat("Decimal", variantOf(Field.of("A", SemanticType.DECIMAL)), Matchers.equalTo("numeric"));
        assertThat("Date", variantOf(Field.of("A", SemanticType.DATE)), Matchers.equalTo("date-time"));
        assertThat("Text", variantOf(Field.of("A", SemanticType.TEXT)), Matchers.equalTo("text"));
        assertThat("Email", variantOf(Field.of("A", SemanticType.EMAIL)), Matchers.equalTo("text"));
        assertThat("Text category", variantOf(new Field("A", SemanticType.TEXT, SemanticType.CATEGORY)), Matchers.equalTo("category"));
        assertThat("Country", variantOf(new Field("A", SemanticType.TEXT, SemanticType.COUNTRY)), Matchers.equalTo("category"));
    }

    @Test
    public void testNumberBeforeCategory() {
        assertThat("Numeric category should be numeric",
            variantOf(new Field("A", SemanticType.INTEGER, SemanticType.CATEGORY)), Matchers.equalTo("numeric"));
        assertThat("Date category should be date-time",
            variantOf(new Field("A", SemanticType.DATE, SemanticType.CATEGORY)), Matchers.equalTo("date-time"));
    }

    @Test
    public void testPairs() {
        Field quantity = Field.of("QUANTITY", SemanticType.INTEGER);
        Field total = Field.of("TOTAL", SemanticType.FLOAT);
        Field createdAt = Field.of("CREATED_AT", SemanticType.DATE_TIME);
        Field comment = Field.of("COMMENT", SemanticType.TEXT);

        assertThat("Two numbers", variantOf(quantity, total), Matchers.equalTo("number-pair"));
        assertThat("Time and number", variantOf(createdAt, total), Matchers.equalTo("time-series"));
        assertThat("Number and time", variantOf(total, createdAt), Matchers.nullValue());
        assertThat("Text and number", variantOf(comment, total), Matchers.nullValue());
    }

    @Test
    public void testUnclaimedSignatures() {
        assertThat("Primary key", variantOf(Field.of("ID", SemanticType.PK)), Matchers.nullValue());
        assertThat("Dictionary", variantOf(Field.of("PAYLOAD", SemanticType.DICTIONARY)), Matchers.nullValue());
    }

    @Test
    public void testSignatureOfThreeFields() {
        Field any = Field.of("A", SemanticType.INTEGER);

        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class, () -> TypeSignature.of(any, any, any));
        assertThat("Message should name the arity", e.getMessage(), Matchers.containsString("got 3"));
    }

    @Test
    public void testCustomRules() {
        ProfilerStrategy text = new TextProfiler();
        VariantResolver custom = new VariantResolver(Arrays.asList(
            new VariantResolver.Rule("everything is text", signature -> true, text)
        ));

        Optional<ProfilerStrategy> resolved = custom.resolve(TypeSignature.of(Field.of("A", SemanticType.INTEGER)));
        assertThat("First matching rule wins", resolved.get(), Matchers.sameInstance(text));
        assertThat("Wrong rule description", custom.getRules().get(0).toString(), Matchers.equalTo("everything is text -> text"));
    }
}
