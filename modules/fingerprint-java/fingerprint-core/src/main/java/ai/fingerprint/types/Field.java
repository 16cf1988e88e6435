package ai.fingerprint.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Column descriptor. Carried through to fingerprints untouched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Field {

    private final String name;
    private final String displayName;
    private final String description;
    private final SemanticType baseType;
    private final SemanticType specialType;

    public Field(String name, SemanticType baseType, SemanticType specialType) {
        this(name, null, null, baseType, specialType);
    }

    public Field(String name, String displayName, String description, SemanticType baseType, SemanticType specialType) {
        this.name = Objects.requireNonNull(name, "name");
        this.displayName = displayName;
        this.description = description;
        this.baseType = Objects.requireNonNull(baseType, "baseType");
        this.specialType = specialType;
    }

    public static Field of(String name, SemanticType baseType) {
        return new Field(name, baseType, null);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("display_name")
    public String getDisplayName() {
        return displayName;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("base_type")
    public SemanticType getBaseType() {
        return baseType;
    }

    @JsonProperty("special_type")
    public SemanticType getSpecialType() {
        return specialType;
    }

    /**
     * Dispatch tag of this field, a missing special type matches any special type.
     */
    public TypeTag typeTag() {
        return new TypeTag(baseType, specialType == null ? SemanticType.ANY : specialType);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>(5);
        result.put("name", name);
        if (displayName != null) {
            result.put("display_name", displayName);
        }
        if (description != null) {
            result.put("description", description);
        }
        result.put("base_type", baseType);
        if (specialType != null) {
            result.put("special_type", specialType);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Field field = (Field) o;
        return name.equals(field.name)
            && Objects.equals(displayName, field.displayName)
            && Objects.equals(description, field.description)
            && baseType == field.baseType
            && specialType == field.specialType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, displayName, description, baseType, specialType);
    }

    @Override
    public String toString() {
        return String.format("Field{%s %s/%s}", name, baseType, specialType == null ? SemanticType.ANY : specialType);
    }
}
