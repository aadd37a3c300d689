package com.templatebinder.matching;

import java.util.regex.Pattern;

/**
 * A case-insensitive layer-name regex with the confidence a hit earns.
 */
public final class LayerPattern {
    private final String category;
    private final String regex;
    private final Pattern pattern;
    private final double baseConfidence;

    public LayerPattern(String category, String regex, double baseConfidence) {
        this.category = category;
        this.regex = regex;
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        this.baseConfidence = baseConfidence;
    }

    public String getCategory() {
        return category;
    }

    public String getRegex() {
        return regex;
    }

    public double getBaseConfidence() {
        return baseConfidence;
    }

    public boolean matches(String layerName) {
        return layerName != null && pattern.matcher(layerName).lookingAt();
    }
}
