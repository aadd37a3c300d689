package com.templatebinder.variables;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single entry of the variable catalog.
 * The name carries no store prefix; {@link #getStoreName()} is the layer name used
 * inside the variable store composition.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class VariableDefinition {

    public static final String STORE_PREFIX = "z";

    private final String name;
    private final VariableCategory category;
    private final VariableDataType dataType;
    private final String description;
    private final String defaultValue;

    @JsonCreator
    public VariableDefinition(@JsonProperty("name") String name,
                              @JsonProperty("category") VariableCategory category,
                              @JsonProperty("dataType") VariableDataType dataType,
                              @JsonProperty("description") String description,
                              @JsonProperty("defaultValue") String defaultValue) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name is required");
        }
        this.name = name;
        this.category = Objects.requireNonNull(category, "category");
        this.dataType = Objects.requireNonNull(dataType, "dataType");
        this.description = description != null ? description : "";
        this.defaultValue = defaultValue;
    }

    public String getName() {
        return name;
    }

    public VariableCategory getCategory() {
        return category;
    }

    public VariableDataType getDataType() {
        return dataType;
    }

    public String getDescription() {
        return description;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    @JsonProperty("storeName")
    public String getStoreName() {
        return STORE_PREFIX + name;
    }

    /**
     * Strips a single leading store marker, if present.
     */
    public static String stripStorePrefix(String nameOrStoreName) {
        if (nameOrStoreName != null && nameOrStoreName.startsWith(STORE_PREFIX)) {
            return nameOrStoreName.substring(STORE_PREFIX.length());
        }
        return nameOrStoreName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableDefinition)) return false;
        VariableDefinition that = (VariableDefinition) o;
        return name.equals(that.name)
            && category == that.category
            && dataType == that.dataType
            && description.equals(that.description)
            && Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, category, dataType);
    }

    @Override
    public String toString() {
        return name + " (" + category.getValue() + ", " + dataType.getValue() + ")";
    }
}
