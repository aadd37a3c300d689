package com.templatebinder.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Errors make a store composition unusable; warnings only flag layout oddities.
 */
public final class StoreValidationResult {
    private final List<String> errors;
    private final List<String> warnings;

    StoreValidationResult(List<String> errors, List<String> warnings) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public String getMessage() {
        if (!errors.isEmpty()) {
            return "Validation failed: " + errors.size() + " error(s), details: "
                + errors.subList(0, Math.min(3, errors.size()));
        }
        if (!warnings.isEmpty()) {
            return "Validation passed with " + warnings.size() + " warning(s)";
        }
        return "Validation passed with no issues";
    }
}
