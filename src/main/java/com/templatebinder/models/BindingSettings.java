package com.templatebinder.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.templatebinder.expressions.ExpressionConfig;
import com.templatebinder.matching.PatternLookupMode;

/**
 * Per-workspace binding preferences, stored as JSON next to the templates.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BindingSettings {
    private String storeCompositionName = ExpressionConfig.DEFAULT_STORE_COMPOSITION;
    private boolean lowercaseComparison = true;
    private double minConfidence = 0.6;
    private PatternLookupMode patternLookup = PatternLookupMode.CAMEL_CASE;
    private int logoMaxWidth = 500;
    private int logoMaxHeight = 500;

    public static BindingSettings defaults() {
        return new BindingSettings();
    }

    public String getStoreCompositionName() { return storeCompositionName; }
    public void setStoreCompositionName(String storeCompositionName) { this.storeCompositionName = storeCompositionName; }

    public boolean isLowercaseComparison() { return lowercaseComparison; }
    public void setLowercaseComparison(boolean lowercaseComparison) { this.lowercaseComparison = lowercaseComparison; }

    public double getMinConfidence() { return minConfidence; }
    public void setMinConfidence(double minConfidence) { this.minConfidence = minConfidence; }

    public PatternLookupMode getPatternLookup() { return patternLookup; }
    public void setPatternLookup(PatternLookupMode patternLookup) { this.patternLookup = patternLookup; }

    public int getLogoMaxWidth() { return logoMaxWidth; }
    public void setLogoMaxWidth(int logoMaxWidth) { this.logoMaxWidth = logoMaxWidth; }

    public int getLogoMaxHeight() { return logoMaxHeight; }
    public void setLogoMaxHeight(int logoMaxHeight) { this.logoMaxHeight = logoMaxHeight; }

    public ExpressionConfig toExpressionConfig() {
        return new ExpressionConfig(storeCompositionName, lowercaseComparison);
    }

    /**
     * Rejects values the analyzer and synthesizer cannot work with.
     */
    public void validate() {
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be between 0 and 1, got " + minConfidence);
        }
        if (logoMaxWidth <= 0 || logoMaxHeight <= 0) {
            throw new IllegalArgumentException("Logo maximum dimensions must be positive");
        }
        if (storeCompositionName == null || storeCompositionName.isBlank()) {
            throw new IllegalArgumentException("storeCompositionName is required");
        }
    }
}
