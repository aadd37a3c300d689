package com.templatebinder.variables;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Categories for organizing variable store entries.
 */
public enum VariableCategory {
    TEAM("team"),
    SCORE("score"),
    EVENT("event"),
    PLAYER("player"),
    TEMPLATE_CONTROL("templateControl"),
    MEDIA("media");

    private final String value;

    VariableCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static VariableCategory fromValue(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (VariableCategory category : values()) {
            if (category.value.equalsIgnoreCase(trimmed) || category.name().equalsIgnoreCase(trimmed)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown variable category: " + value);
    }
}
