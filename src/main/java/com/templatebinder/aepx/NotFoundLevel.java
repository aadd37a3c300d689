package com.templatebinder.aepx;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The document level at which a lookup came up empty.
 */
public enum NotFoundLevel {
    COMPOSITION,
    LAYER,
    PROPERTY,
    EXPRESSION;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
