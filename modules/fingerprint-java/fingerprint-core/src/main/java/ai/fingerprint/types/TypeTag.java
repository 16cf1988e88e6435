package ai.fingerprint.types;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * (base type, special type) tag of one column.
 */
public class TypeTag {

    private final SemanticType base;
    private final SemanticType special;

    public TypeTag(SemanticType base, SemanticType special) {
        this.base = Objects.requireNonNull(base, "base");
        this.special = Objects.requireNonNull(special, "special");
    }

    public static TypeTag of(SemanticType base, SemanticType special) {
        return new TypeTag(base, special);
    }

    public SemanticType getBase() {
        return base;
    }

    public SemanticType getSpecial() {
        return special;
    }

    /**
     * True when both components derive from the corresponding components of {@code pattern}.
     */
    public boolean isA(TypeTag pattern) {
        return base.isA(pattern.base) && special.isA(pattern.special);
    }

    @JsonValue
    public List<SemanticType> toList() {
        return Arrays.asList(base, special);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TypeTag typeTag = (TypeTag) o;
        return base == typeTag.base && special == typeTag.special;
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, special);
    }

    @Override
    public String toString() {
        return "[" + base + " " + special + "]";
    }
}
