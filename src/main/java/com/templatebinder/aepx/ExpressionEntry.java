package com.templatebinder.aepx;

/**
 * One expression found in a document: where it lives and its text without CDATA markers.
 */
public record ExpressionEntry(String comp, String layer, String property, String expression) {}
