package com.templatebinder.matching;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Layer classification taken from a layer's {@code type} attribute.
 */
public enum LayerKind {
    TEXT("text"),
    SHAPE("shape"),
    IMAGE("image"),
    VIDEO("video"),
    SOLID("solid"),
    NULL("null"),
    UNKNOWN("unknown");

    private final String value;

    LayerKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Case-insensitive; missing or unrecognized types map to {@link #UNKNOWN}.
     */
    @JsonCreator
    public static LayerKind fromAttribute(String type) {
        if (type == null) {
            return UNKNOWN;
        }
        String normalized = type.trim().toLowerCase(Locale.ROOT);
        for (LayerKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
