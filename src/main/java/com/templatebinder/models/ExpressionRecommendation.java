package com.templatebinder.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.templatebinder.expressions.ExpressionTarget;
import com.templatebinder.matching.LayerKind;
import com.templatebinder.matching.MatchConfidence;
import com.templatebinder.variables.VariableDefinition;

/**
 * A suggested binding for one layer. Either applied (becoming a {@link LayerExpression}
 * in the document) or discarded; never stored on its own.
 */
public final class ExpressionRecommendation {
    private final String compositionName;
    private final String layerName;
    private final LayerKind layerKind;
    private final VariableDefinition variable;
    private final ExpressionTarget target;
    private final String expression;
    private final double confidence;
    private final String reason;

    public ExpressionRecommendation(String compositionName, String layerName, LayerKind layerKind,
                                    VariableDefinition variable, ExpressionTarget target, String expression,
                                    double confidence, String reason) {
        this.compositionName = compositionName;
        this.layerName = layerName;
        this.layerKind = layerKind;
        this.variable = variable;
        this.target = target;
        this.expression = expression;
        this.confidence = confidence;
        this.reason = reason;
    }

    public String getCompositionName() {
        return compositionName;
    }

    public String getLayerName() {
        return layerName;
    }

    public LayerKind getLayerKind() {
        return layerKind;
    }

    @JsonIgnore
    public VariableDefinition getVariable() {
        return variable;
    }

    public String getVariableName() {
        return variable.getName();
    }

    public ExpressionTarget getTarget() {
        return target;
    }

    public String getExpression() {
        return expression;
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

    public LayerExpression toLayerExpression() {
        return new LayerExpression(compositionName, layerName, target, expression);
    }

    @Override
    public String toString() {
        return compositionName + "/" + layerName + " -> " + variable.getName()
            + " (" + Math.round(confidence * 100) + "%)";
    }
}
