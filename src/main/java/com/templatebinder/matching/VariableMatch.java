package com.templatebinder.matching;

import com.templatebinder.variables.VariableDefinition;

/**
 * Outcome of classifying one layer name against the catalog.
 */
public final class VariableMatch {
    private final VariableDefinition variable;
    private final double confidence;
    private final String reason;
    private final MatchStrategy strategy;

    public VariableMatch(VariableDefinition variable, double confidence, String reason, MatchStrategy strategy) {
        this.variable = variable;
        this.confidence = confidence;
        this.reason = reason;
        this.strategy = strategy;
    }

    public VariableDefinition getVariable() {
        return variable;
    }

    public double getConfidence() {
        return confidence;
    }

    public MatchConfidence getBucket() {
        return MatchConfidence.forScore(confidence);
    }

    public String getReason() {
        return reason;
    }

    public MatchStrategy getStrategy() {
        return strategy;
    }

    @Override
    public String toString() {
        return variable.getName() + " (" + confidence + ", " + strategy + "): " + reason;
    }
}
