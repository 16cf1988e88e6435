package ai.fingerprint.types;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Dispatch key of a fingerprint: the type tag of a column, or of each column of a pair.
 */
public class TypeSignature {

    public static final TypeSignature NUMBER = of(TypeTag.of(SemanticType.NUMBER, SemanticType.ANY));
    public static final TypeSignature DATE_TIME = of(TypeTag.of(SemanticType.DATE_TIME, SemanticType.ANY));
    public static final TypeSignature CATEGORY = of(TypeTag.of(SemanticType.ANY, SemanticType.CATEGORY));
    public static final TypeSignature TEXT = of(TypeTag.of(SemanticType.TEXT, SemanticType.ANY));
    public static final TypeSignature ANY = of(TypeTag.of(SemanticType.ANY, SemanticType.ANY));
    public static final TypeSignature NUMBER_NUMBER = of(NUMBER.tags.get(0), NUMBER.tags.get(0));
    public static final TypeSignature DATE_TIME_NUMBER = of(DATE_TIME.tags.get(0), NUMBER.tags.get(0));

    private final List<TypeTag> tags;

    private TypeSignature(List<TypeTag> tags) {
        if (tags.isEmpty() || tags.size() > 2) {
            throw new IllegalArgumentException("Type signature should describe one column or a pair of columns, got " + tags.size());
        }
        this.tags = Collections.unmodifiableList(new ArrayList<>(tags));
    }

    public static TypeSignature of(TypeTag... tags) {
        return new TypeSignature(Arrays.asList(tags));
    }

    public static TypeSignature of(Field... fields) {
        List<TypeTag> tags = new ArrayList<>(fields.length);
        for (Field field : fields) {
            tags.add(Objects.requireNonNull(field, "field").typeTag());
        }
        return new TypeSignature(tags);
    }

    public List<TypeTag> getTags() {
        return tags;
    }

    public boolean isPair() {
        return tags.size() == 2;
    }

    /**
     * Element-wise {@link TypeTag#isA(TypeTag)} against a pattern of the same arity.
     */
    public boolean isA(TypeSignature pattern) {
        if (pattern.tags.size() != tags.size()) {
            return false;
        }
        for (int i = 0; i < tags.size(); i++) {
            if (!tags.get(i).isA(pattern.tags.get(i))) {
                return false;
            }
        }
        return true;
    }

    @JsonValue
    public Object toJsonValue() {
        return isPair() ? tags : tags.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return tags.equals(((TypeSignature) o).tags);
    }

    @Override
    public int hashCode() {
        return tags.hashCode();
    }

    @Override
    public String toString() {
        return isPair() ? tags.toString() : tags.get(0).toString();
    }
}
