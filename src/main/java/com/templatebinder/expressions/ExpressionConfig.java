package com.templatebinder.expressions;

/**
 * Settings shared by every synthesized expression.
 */
public final class ExpressionConfig {

    public static final String DEFAULT_STORE_COMPOSITION = "Hard_Card";

    private final String storeCompositionName;
    private final boolean lowercaseComparison;

    public ExpressionConfig(String storeCompositionName, boolean lowercaseComparison) {
        this.storeCompositionName = storeCompositionName == null || storeCompositionName.isBlank()
            ? DEFAULT_STORE_COMPOSITION
            : storeCompositionName;
        this.lowercaseComparison = lowercaseComparison;
    }

    public static ExpressionConfig defaults() {
        return new ExpressionConfig(DEFAULT_STORE_COMPOSITION, true);
    }

    public String getStoreCompositionName() {
        return storeCompositionName;
    }

    public boolean isLowercaseComparison() {
        return lowercaseComparison;
    }
}
