package com.templatebinder.aepx;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of an expression discovery scan. Serializes to the export shape
 * {@code {count, layers: [{comp, layer, property, expression}], message}}.
 */
@JsonPropertyOrder({"count", "layers", "message"})
public final class ExpressionListing {
    private final boolean success;
    private final List<ExpressionEntry> layers;
    private final String message;

    private ExpressionListing(boolean success, List<ExpressionEntry> layers, String message) {
        this.success = success;
        this.layers = Collections.unmodifiableList(new ArrayList<>(layers));
        this.message = message;
    }

    static ExpressionListing of(List<ExpressionEntry> layers) {
        return new ExpressionListing(true, layers,
            "Found " + layers.size() + " layers with expressions");
    }

    static ExpressionListing failure(String message) {
        return new ExpressionListing(false, List.of(), message);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return success;
    }

    public int getCount() {
        return layers.size();
    }

    public List<ExpressionEntry> getLayers() {
        return layers;
    }

    public String getMessage() {
        return message;
    }
}
