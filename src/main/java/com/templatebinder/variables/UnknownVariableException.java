package com.templatebinder.variables;

/**
 * Raised when a caller asks for a variable the catalog does not define.
 * This is a caller/catalog mismatch, not bad template data.
 */
public class UnknownVariableException extends IllegalArgumentException {

    private final String variableName;

    public UnknownVariableException(String variableName) {
        super("Variable '" + variableName + "' not found in the variable catalog. "
            + "Use VariableRegistry.getNames() to see available variables.");
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
