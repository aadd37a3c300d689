package com.templatebinder.expressions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Layer properties an expression can be bound to, each with the property name the
 * template document uses for it.
 */
public enum ExpressionTarget {
    TEXT_SOURCE("textSource", "sourceText"),
    OPACITY("opacity", "opacity"),
    SCALE("scale", "scale"),
    POSITION("position", "position"),
    COLOR("color", "fillColor"),
    ROTATION("rotation", "rotation"),
    ANCHOR_POINT("anchorPoint", "anchorPoint");

    private final String id;
    private final String propertyName;

    ExpressionTarget(String id, String propertyName) {
        this.id = id;
        this.propertyName = propertyName;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getPropertyName() {
        return propertyName;
    }

    /**
     * Accepts the target id, the document property name, or the enum constant name.
     */
    @JsonCreator
    public static ExpressionTarget fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Expression target is required");
        }
        String trimmed = value.trim();
        for (ExpressionTarget target : values()) {
            if (target.id.equalsIgnoreCase(trimmed)
                || target.propertyName.equalsIgnoreCase(trimmed)
                || target.name().equalsIgnoreCase(trimmed)) {
                return target;
            }
        }
        throw new IllegalArgumentException("Unknown expression target: " + value);
    }
}
