package com.templatebinder.store;

import com.templatebinder.variables.VariableDefinition;

/**
 * One text layer of the store composition, holding a single variable's current value.
 */
public record StoreLayer(VariableDefinition variable, String name, String sourceText, int x, int y,
                         int fontSize, String fontFamily, String fillColor) {

    public static StoreLayer of(VariableDefinition variable, int x, int y, StoreLayout layout) {
        String text = variable.getDefaultValue() != null ? variable.getDefaultValue() : "";
        return new StoreLayer(variable, variable.getStoreName(), text, x, y,
            layout.fontSize(), layout.fontFamily(), layout.fillColor());
    }
}
