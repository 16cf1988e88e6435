package ai.fingerprint.types;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Base and special column types. Types form a hierarchy rooted at {@link #ANY}; a type
 * {@link #isA(SemanticType) is a} type when it is that type or derives from it.
 */
public enum SemanticType {

    ANY("type/*"),

    NUMBER("type/Number", ANY),
    INTEGER("type/Integer", NUMBER),
    BIG_INTEGER("type/BigInteger", INTEGER),
    FLOAT("type/Float", NUMBER),
    DECIMAL("type/Decimal", FLOAT),

    TEXT("type/Text", ANY),
    URL("type/URL", TEXT),
    EMAIL("type/Email", TEXT),

    DATE_TIME("type/DateTime", ANY),
    DATE("type/Date", DATE_TIME),
    TIME("type/Time", DATE_TIME),

    CATEGORY("type/Category", ANY),
    BOOLEAN("type/Boolean", CATEGORY),
    ENUM("type/Enum", CATEGORY),
    NAME("type/Name", CATEGORY),
    CITY("type/City", CATEGORY),
    STATE("type/State", CATEGORY),
    COUNTRY("type/Country", CATEGORY),

    PK("type/PK", ANY),
    FK("type/FK", ANY),

    DICTIONARY("type/Dictionary", ANY),
    ARRAY("type/Array", ANY);

    private final String typeName;
    private final List<SemanticType> parents;

    SemanticType(String typeName, SemanticType... parents) {
        this.typeName = typeName;
        this.parents = parents.length == 0 ? Collections.emptyList() : Arrays.asList(parents);
    }

    @JsonValue
    public String typeName() {
        return typeName;
    }

    public boolean isA(SemanticType other) {
        if (this == other || other == ANY) {
            return true;
        }
        for (SemanticType parent : parents) {
            if (parent.isA(other)) {
                return true;
            }
        }
        return false;
    }

    public static SemanticType fromTypeName(String typeName) {
        for (SemanticType type : values()) {
            if (type.typeName.equals(typeName)) {
                return type;
            }
        }
        throw new IllegalArgumentException(String.format("Unknown type '%s'", typeName));
    }

    @Override
    public String toString() {
        return typeName;
    }
}
