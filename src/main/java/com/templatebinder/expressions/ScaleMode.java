package com.templatebinder.expressions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How an image is scaled against its composition: fit inside (may letterbox)
 * or cover completely (may crop).
 */
public enum ScaleMode {
    FIT("fit", "min"),
    COVER("cover", "max");

    private final String id;
    private final String mathFunction;

    ScaleMode(String id, String mathFunction) {
        this.id = id;
        this.mathFunction = mathFunction;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    String getMathFunction() {
        return mathFunction;
    }

    @JsonCreator
    public static ScaleMode fromValue(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (ScaleMode mode : values()) {
                if (mode.id.equalsIgnoreCase(trimmed) || mode.mathFunction.equalsIgnoreCase(trimmed)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Scale mode must be 'fit' or 'cover', got '" + value + "'");
    }
}
