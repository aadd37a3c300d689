package com.templatebinder.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.templatebinder.expressions.ExpressionTarget;

/**
 * An expression bound to one layer property; the unit the writer puts into a document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LayerExpression {
    private String compositionName;
    private String layerName;
    private ExpressionTarget target;
    private String expression;
    private boolean enabled = true;

    public LayerExpression() {
    }

    public LayerExpression(String compositionName, String layerName, ExpressionTarget target, String expression) {
        this.compositionName = compositionName;
        this.layerName = layerName;
        this.target = target;
        this.expression = expression;
    }

    public String getCompositionName() { return compositionName; }
    public void setCompositionName(String compositionName) { this.compositionName = compositionName; }

    public String getLayerName() { return layerName; }
    public void setLayerName(String layerName) { this.layerName = layerName; }

    public ExpressionTarget getTarget() { return target; }
    public void setTarget(ExpressionTarget target) { this.target = target; }

    public String getExpression() { return expression; }
    public void setExpression(String expression) { this.expression = expression; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    @Override
    public String toString() {
        return compositionName + "/" + layerName + "/" + (target != null ? target.getPropertyName() : "?");
    }
}
