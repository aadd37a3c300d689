package com.templatebinder.aepx;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a single add or remove on a template document.
 * Failures carry either the missing document level or the validator's messages.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExpressionWriteResult {
    private final boolean success;
    private final String message;
    private final String composition;
    private final String layer;
    private final String property;
    private final NotFoundLevel missingLevel;
    private final List<String> errors;

    private ExpressionWriteResult(boolean success, String message, String composition, String layer,
                                  String property, NotFoundLevel missingLevel, List<String> errors) {
        this.success = success;
        this.message = message;
        this.composition = composition;
        this.layer = layer;
        this.property = property;
        this.missingLevel = missingLevel;
        this.errors = errors == null || errors.isEmpty()
            ? null
            : Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public static ExpressionWriteResult written(String composition, String layer, String property) {
        return new ExpressionWriteResult(true, "Expression added successfully to " + layer,
            composition, layer, property, null, null);
    }

    public static ExpressionWriteResult removed(String composition, String layer, String property) {
        return new ExpressionWriteResult(true, "Expression removed from " + layer,
            composition, layer, property, null, null);
    }

    public static ExpressionWriteResult notFound(NotFoundLevel level, String message) {
        return new ExpressionWriteResult(false, message, null, null, null, level, null);
    }

    public static ExpressionWriteResult invalid(List<String> errors) {
        return new ExpressionWriteResult(false,
            "Expression syntax validation failed: " + String.join("; ", errors),
            null, null, null, null, errors);
    }

    public static ExpressionWriteResult failure(String message) {
        return new ExpressionWriteResult(false, message, null, null, null, null, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public String getComposition() {
        return composition;
    }

    public String getLayer() {
        return layer;
    }

    public String getProperty() {
        return property;
    }

    public NotFoundLevel getMissingLevel() {
        return missingLevel;
    }

    public List<String> getErrors() {
        return errors != null ? errors : Collections.emptyList();
    }

    public boolean isNotFound() {
        return missingLevel != null;
    }
}
