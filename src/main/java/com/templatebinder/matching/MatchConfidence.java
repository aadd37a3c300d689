package com.templatebinder.matching;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Discrete trust levels for a layer-to-variable match.
 */
public enum MatchConfidence {
    EXACT(1.0),
    HIGH(0.9),
    GOOD(0.75),
    MEDIUM(0.6),
    LOW(0.4);

    private final double value;

    MatchConfidence(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * The highest bucket whose threshold the score reaches; anything under MEDIUM is LOW.
     */
    public static MatchConfidence forScore(double score) {
        for (MatchConfidence bucket : values()) {
            if (score >= bucket.value) {
                return bucket;
            }
        }
        return LOW;
    }
}
