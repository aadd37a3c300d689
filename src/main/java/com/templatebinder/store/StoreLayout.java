package com.templatebinder.store;

/**
 * Grid placement and text styling for the store composition's layers.
 * {@code fillColor} is an RGBA string with channels in 0.0-1.0.
 */
public record StoreLayout(int columns, int startX, int startY, int horizontalSpacing, int verticalSpacing,
                          int fontSize, String fontFamily, String fillColor) {

    public StoreLayout {
        if (columns <= 0) {
            throw new IllegalArgumentException("columns must be positive, got " + columns);
        }
    }

    public static StoreLayout defaults() {
        return new StoreLayout(4, 50, 50, 400, 60, 40, "Arial", "1.0,1.0,1.0,1.0");
    }
}
