package com.templatebinder.matching;

import com.templatebinder.expressions.ExpressionTarget;
import com.templatebinder.variables.VariableDataType;
import com.templatebinder.variables.VariableDefinition;

/**
 * Picks the layer property an expression should drive, from the layer kind and the
 * variable's data type.
 */
public final class TargetResolver {

    private TargetResolver() {
    }

    public static ExpressionTarget resolve(LayerKind kind, VariableDefinition variable) {
        VariableDataType dataType = variable != null ? variable.getDataType() : null;
        LayerKind effective = kind != null ? kind : LayerKind.UNKNOWN;
        switch (effective) {
            case TEXT:
                return ExpressionTarget.TEXT_SOURCE;
            case SHAPE:
                return dataType == VariableDataType.COLOR ? ExpressionTarget.COLOR : ExpressionTarget.OPACITY;
            case IMAGE:
            case VIDEO:
                return dataType == VariableDataType.LOGO || dataType == VariableDataType.IMAGE
                    ? ExpressionTarget.SCALE
                    : ExpressionTarget.OPACITY;
            default:
                // solid, null and unknown layers only get visibility control
                return ExpressionTarget.OPACITY;
        }
    }
}
