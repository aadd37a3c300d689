package com.templatebinder.expressions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ExpressionValidationResult {
    private final List<String> errors;

    private ExpressionValidationResult(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            this.errors = Collections.emptyList();
        } else {
            this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        }
    }

    public static ExpressionValidationResult ok() {
        return new ExpressionValidationResult(Collections.emptyList());
    }

    public static ExpressionValidationResult of(List<String> errors) {
        return new ExpressionValidationResult(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    public String summary() {
        if (errors.isEmpty()) {
            return "Syntax validation passed";
        }
        return "Syntax validation failed: " + errors.size() + " error(s): " + String.join("; ", errors);
    }
}
