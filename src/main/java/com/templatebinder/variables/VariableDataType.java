package com.templatebinder.variables;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum VariableDataType {
    TEXT("text"),
    NUMBER("number"),
    COLOR("color"),
    IMAGE("image"),
    LOGO("logo");

    private final String value;

    VariableDataType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static VariableDataType fromValue(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (VariableDataType type : values()) {
            if (type.value.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown variable data type: " + value);
    }
}
