package com.templatebinder.expressions;

import com.templatebinder.variables.VariableDefinition;
import com.templatebinder.variables.VariableRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Produces expression code that binds a layer property to the variable store composition.
 * <p>
 * Every method that references a variable resolves it against the {@link VariableRegistry}
 * first and throws {@link com.templatebinder.variables.UnknownVariableException} for a
 * name the catalog does not define. Store layers are always addressed by the variable's
 * canonical store name.
 */
public class ExpressionSynthesizer {

    private final VariableRegistry registry;
    private final ExpressionConfig config;

    public ExpressionSynthesizer(VariableRegistry registry, ExpressionConfig config) {
        this.registry = registry != null ? registry : VariableRegistry.standard();
        this.config = config != null ? config : ExpressionConfig.defaults();
    }

    public ExpressionSynthesizer() {
        this(VariableRegistry.standard(), ExpressionConfig.defaults());
    }

    public ExpressionConfig getConfig() {
        return config;
    }

    /**
     * Text source that resolves the store layer from the consuming layer's own name at
     * evaluation time, so one expression works for any layer named after a variable.
     */
    public String textLink() {
        return storeComp() + ".layer(\"" + VariableDefinition.STORE_PREFIX + "\" + thisLayer.name).text.sourceText";
    }

    public String textLink(String variableName) {
        return storeText(registry.require(variableName));
    }

    public String concatenate(List<String> variableNames) {
        if (variableNames == null || variableNames.isEmpty()) {
            throw new IllegalArgumentException("variables list cannot be empty");
        }
        return concatenate(variableNames, Collections.nCopies(variableNames.size() - 1, " "));
    }

    /**
     * Joins several store values with literal separators, e.g. month, day and year into a date.
     * {@code separators} must hold exactly one entry fewer than {@code variableNames}.
     */
    public String concatenate(List<String> variableNames, List<String> separators) {
        if (variableNames == null || variableNames.isEmpty()) {
            throw new IllegalArgumentException("variables list cannot be empty");
        }
        List<VariableDefinition> variables = new ArrayList<>();
        for (String name : variableNames) {
            variables.add(registry.require(name));
        }
        List<String> seps = separators != null ? separators : Collections.nCopies(variables.size() - 1, " ");
        if (seps.size() != variables.size() - 1) {
            throw new IllegalArgumentException("separators must have " + (variables.size() - 1)
                + " elements (one less than variables), got " + seps.size());
        }

        StringBuilder sb = new StringBuilder("// Concatenate multiple variable store values\n");
        for (int i = 0; i < variables.size(); i++) {
            sb.append("var txt").append(i + 1).append(" = ").append(storeText(variables.get(i))).append(";\n");
        }
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < variables.size(); i++) {
            parts.add("txt" + (i + 1));
            if (i < seps.size()) {
                parts.add(quote(seps.get(i)));
            }
        }
        sb.append(String.join(" + ", parts));
        return sb.toString();
    }

    /**
     * Opacity that shows the layer (100) when the store text equals {@code targetValue},
     * or the inverse when {@code visibleWhenMatch} is false.
     */
    public String conditionalVisibilityText(String variableName, String targetValue, boolean visibleWhenMatch) {
        VariableDefinition variable = registry.require(variableName);
        String value = targetValue != null ? targetValue : "";
        String comparison = config.isLowercaseComparison()
            ? "text1.toLowerCase() == " + quote(value.toLowerCase(Locale.ROOT))
            : "text1 == " + quote(value);
        return "// Show/hide based on text value\n"
            + "var text1 = " + storeText(variable) + ";\n"
            + "if (" + comparison + ") " + visibilityBranches(visibleWhenMatch);
    }

    public String conditionalVisibilityNumber(String variableName, int targetValue, boolean visibleWhenMatch) {
        VariableDefinition variable = registry.require(variableName);
        return "// Show/hide based on numeric value\n"
            + "var value = parseInt(" + storeText(variable) + ");\n"
            + "if (value == " + targetValue + ") " + visibilityBranches(visibleWhenMatch);
    }

    /**
     * Uniform scale that fits the consuming layer inside {@code maxWidth} x {@code maxHeight}.
     */
    public String logoScaleToFit(int maxWidth, int maxHeight) {
        if (maxWidth <= 0 || maxHeight <= 0) {
            throw new IllegalArgumentException("Maximum dimensions must be positive, got "
                + maxWidth + "x" + maxHeight);
        }
        return "// Scale logo to fit within max dimensions while maintaining aspect ratio\n"
            + "var maxWidth = " + maxWidth + ";\n"
            + "var maxHeight = " + maxHeight + ";\n"
            + "var scaleWidth = (maxWidth / thisLayer.width) * 100;\n"
            + "var scaleHeight = (maxHeight / thisLayer.height) * 100;\n"
            + "var finalScale = Math.min(scaleWidth, scaleHeight);\n"
            + "[finalScale, finalScale]";
    }

    public String imageScaleToComp(ScaleMode mode) {
        ScaleMode effective = mode != null ? mode : ScaleMode.FIT;
        return "// Scale image to " + effective.getId() + " composition\n"
            + "var x = 100 * thisComp.width / thisLayer.width;\n"
            + "var y = 100 * thisComp.height / thisLayer.height;\n"
            + "var s = Math." + effective.getMathFunction() + "(x, y);\n"
            + "[s, s]";
    }

    /**
     * Wraps the store's hex code in the host's hexToRgb() conversion.
     */
    public String hexColorToRgb(String variableName) {
        VariableDefinition variable = registry.require(variableName);
        return "// Convert hex color to RGB\n"
            + "hexToRgb(" + storeText(variable) + ")";
    }

    /**
     * "#n" (or "(#n)") when the store text is a non-empty number, otherwise an empty string.
     */
    public String rankingDisplay(String variableName, boolean parenthesized) {
        VariableDefinition variable = registry.require(variableName);
        String display = parenthesized ? "\"(#\" + txt1 + \")\"" : "\"#\" + txt1";
        String header = parenthesized
            ? "// Display ranking with (#) format if number, blank otherwise\n"
            : "// Display ranking with # prefix if number, blank otherwise\n";
        return header
            + "var txt1 = " + storeText(variable) + ";\n"
            + "if (!isNaN(txt1) && txt1 !== \"\") { " + display + "; } else { \"\"; }";
    }

    public String compareNumbers(String firstVariable, String secondVariable, ComparisonOperator op) {
        VariableDefinition first = registry.require(firstVariable);
        VariableDefinition second = registry.require(secondVariable);
        if (op == null) {
            throw new IllegalArgumentException("Comparison operator is required");
        }
        return "// " + op.getComment() + "\n"
            + "var text1 = parseInt(" + storeText(first) + ");\n"
            + "var text2 = parseInt(" + storeText(second) + ");\n"
            + "if (text1 " + op.getSymbol() + " text2) { 100; } else { 0; }";
    }

    private String storeComp() {
        return "comp(" + quote(config.getStoreCompositionName()) + ")";
    }

    private String storeText(VariableDefinition variable) {
        return storeComp() + ".layer(" + quote(variable.getStoreName()) + ").text.sourceText";
    }

    private static String visibilityBranches(boolean visibleWhenMatch) {
        int match = visibleWhenMatch ? 100 : 0;
        int noMatch = visibleWhenMatch ? 0 : 100;
        return "{ " + match + "; } else { " + noMatch + "; }";
    }

    // Double-quoted literal. Quotes are backslash-escaped, which the syntax validator skips;
    // backslashes and delimiters become hex escapes so they never pair with a quote or
    // unbalance the expression.
    static String quote(String literal) {
        String value = literal != null ? literal : "";
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                case '\'':
                    sb.append('\\').append(c);
                    break;
                case '\\':
                case '(':
                case ')':
                case '[':
                case ']':
                case '{':
                case '}':
                    sb.append(String.format(Locale.ROOT, "\\x%02x", (int) c));
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
